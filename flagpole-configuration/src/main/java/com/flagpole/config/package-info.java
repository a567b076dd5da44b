/**
 * Flagpole configuration.
 * <ul>
 *   <li>{@link com.flagpole.config.FlagpoleConfig} – registry settings from environment variables or a builder</li>
 *   <li>{@link com.flagpole.config.DuplicatePolicy} – handling of a trigger flag registered twice</li>
 *   <li>{@link com.flagpole.config.FlagSpaceCatalog} – named flag spaces declared in a JSON file</li>
 * </ul>
 */
package com.flagpole.config;
