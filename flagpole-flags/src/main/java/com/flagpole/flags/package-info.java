/**
 * Flag spaces: a fixed, ordered set of capability names, each mapped to one bit of a {@code long}.
 * <ul>
 *   <li>{@link com.flagpole.flags.FlagSpace} – declare names once, look up bit values, render masks for logs</li>
 *   <li>{@link com.flagpole.flags.FlagpoleException} – base of the error taxonomy shared with the registry module</li>
 * </ul>
 * Combine flags with the ordinary {@code |} and {@code &} operators on the returned values.
 */
package com.flagpole.flags;
