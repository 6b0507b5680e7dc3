/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.slotlander.annotation.Immutable;

/**
 * Utility for parsing and accessing the command line options and parameters.
 */
@Immutable
public final class CommandLineOptions {

    /**
     * Parse the array of arguments passed to a Java {@code main} method and create a {@link CommandLineOptions} instance.
     * An argument starting with {@code -} names an option; the argument that follows it, if it is not itself an option,
     * is that option's value.
     *
     * @param args the {@code main} method's parameters; may not be null
     * @return the representation of the command line options and parameters; never null
     */
    public static CommandLineOptions parse(String[] args) {
        Map<String, String> options = new HashMap<>();
        List<String> params = new ArrayList<>();
        String optionName = null;
        for (String value : args) {
            value = value.trim();
            if (value.startsWith("-")) {
                optionName = value;
                options.put(optionName, "true");
            }
            else if (optionName != null) {
                options.put(optionName, value);
                optionName = null;
            }
            else {
                params.add(value);
            }
        }
        return new CommandLineOptions(options, params);
    }

    private final Map<String, String> options;
    private final List<String> params;

    private CommandLineOptions(Map<String, String> options, List<String> params) {
        this.options = Collections.unmodifiableMap(options);
        this.params = Collections.unmodifiableList(params);
    }

    /**
     * Determine if the option with one of the given names was used on the command line.
     *
     * @param name the name for the option (e.g., "-c" or "--config")
     * @param alternativeName an alternative name for the option; may be null
     * @return true if the option was used, or false otherwise
     */
    public boolean hasOption(String name, String alternativeName) {
        return getOption(name, alternativeName, null) != null;
    }

    /**
     * Obtain the value associated with the option given the name and alternative name of the option, using the supplied default
     * value if none is found.
     *
     * @param name the name for the option (e.g., "-c" or "--config")
     * @param alternativeName an alternative name for the option; may be null
     * @param defaultValue the value that should be returned if no named option was found
     * @return the value associated with the option, or the default value if none was found
     */
    public String getOption(String name, String alternativeName, String defaultValue) {
        String result = options.get(name.trim());
        if (result == null && alternativeName != null) {
            result = options.get(alternativeName.trim());
        }
        return result != null ? result : defaultValue;
    }

    /**
     * Obtain the parameters, i.e. the arguments that are not associated with an option.
     *
     * @return the parameters; never null but possibly empty
     */
    public List<String> getParameters() {
        return params;
    }

    @Override
    public String toString() {
        return "options=" + options + ", params=" + params;
    }
}
