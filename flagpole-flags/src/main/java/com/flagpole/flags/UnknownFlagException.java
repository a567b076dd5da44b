package com.flagpole.flags;

/**
 * Thrown when a flag name or flag value does not exist in the flag space, or when a dependency
 * names a flag that no binding is registered for.
 */
public final class UnknownFlagException extends FlagpoleException {

    private final String flagName;
    private final long flagValue;

    public UnknownFlagException(String flagName) {
        super("Unknown flag: " + flagName);
        this.flagName = flagName;
        this.flagValue = 0L;
    }

    public UnknownFlagException(long flagValue, String message) {
        super(message);
        this.flagName = null;
        this.flagValue = flagValue;
    }

    /** Name that failed the lookup; null when the error concerns a flag value. */
    public String getFlagName() {
        return flagName;
    }

    /** Offending bits; 0 when the error concerns a name lookup. */
    public long getFlagValue() {
        return flagValue;
    }
}
