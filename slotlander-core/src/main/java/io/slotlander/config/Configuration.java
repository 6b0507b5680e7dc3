/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.slotlander.annotation.Immutable;
import io.slotlander.config.Field.ValidationOutput;

/**
 * An immutable representation of a Slotlander configuration. A {@link Configuration} instance can be obtained
 * {@link #from(Properties) from Properties}, {@link #from(Map) from a map} or loaded from a {@link #load(Path) file}.
 * They can also be built by first {@link #create() creating a builder} and then using that builder to populate and
 * {@link Builder#build() return} the immutable Configuration instance.
 * <p>
 * A Configuration object is basically a decorator around a {@link Properties} object. It has methods to get and convert
 * individual property values to numeric and String types, optionally using a default value if the given property value
 * does not exist. It has no methods to set property values, so it can be passed around and reused without concern that
 * other components might change the underlying property values.
 */
@Immutable
public interface Configuration {

    Logger CONFIGURATION_LOGGER = LoggerFactory.getLogger(Configuration.class);

    Pattern PASSWORD_PATTERN = Pattern.compile(".*password$|.*secret\\.key$", Pattern.CASE_INSENSITIVE);

    /**
     * A builder of Configuration objects.
     */
    class Builder {
        private final Properties props = new Properties();

        protected Builder() {
        }

        protected Builder(Properties props) {
            this.props.putAll(props);
        }

        /**
         * Associate the given value with the specified key.
         *
         * @param key the key
         * @param value the value; a null value removes the key
         * @return this builder object so methods can be chained together; never null
         */
        public Builder with(String key, String value) {
            if (value == null) {
                props.remove(key);
            }
            else {
                props.setProperty(key, value);
            }
            return this;
        }

        public Builder with(String key, Object value) {
            return with(key, value != null ? value.toString() : null);
        }

        public Builder with(Field field, String value) {
            return with(field.name(), value);
        }

        public Builder with(Field field, Object value) {
            return with(field.name(), value);
        }

        /**
         * Add all of the properties in the supplied configuration, overwriting any existing values.
         *
         * @param other the configuration whose properties are to be copied; may be null
         * @return this builder object so methods can be chained together; never null
         */
        public Builder with(Configuration other) {
            if (other != null) {
                other.keys().forEach(key -> with(key, other.getString(key)));
            }
            return this;
        }

        /**
         * Build and return the immutable configuration.
         *
         * @return the immutable configuration; never null
         */
        public Configuration build() {
            return Configuration.from(props);
        }
    }

    /**
     * Create a new {@link Builder configuration builder}.
     *
     * @return the configuration builder
     */
    static Builder create() {
        return new Builder();
    }

    /**
     * Create a new {@link Builder configuration builder} that starts with a copy of the supplied configuration.
     *
     * @param config the configuration to copy; may be null
     * @return the configuration builder
     */
    static Builder copy(Configuration config) {
        return config != null ? new Builder(config.asProperties()) : new Builder();
    }

    /**
     * Obtain an empty configuration.
     *
     * @return an empty configuration; never null
     */
    static Configuration empty() {
        return new Configuration() {
            @Override
            public Set<String> keys() {
                return Collections.emptySet();
            }

            @Override
            public String getString(String key) {
                return null;
            }

            @Override
            public String toString() {
                return "{}";
            }
        };
    }

    /**
     * Obtain a configuration instance by copying the supplied Properties object. The supplied {@link Properties} object is
     * copied so that the resulting Configuration cannot be modified.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static Configuration from(Properties properties) {
        Properties props = new Properties();
        if (properties != null) {
            props.putAll(properties);
        }
        return new Configuration() {
            @Override
            public String getString(String key) {
                return props.getProperty(key);
            }

            @Override
            public Set<String> keys() {
                return props.stringPropertyNames();
            }

            @Override
            public String toString() {
                return withMaskedPasswords().asProperties().toString();
            }
        };
    }

    /**
     * Obtain a configuration instance by copying the supplied map of string keys and object values.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static Configuration from(Map<String, ?> properties) {
        Properties props = new Properties();
        if (properties != null) {
            properties.forEach((key, value) -> {
                if (key != null && value != null) {
                    props.setProperty(key, value.toString());
                }
            });
        }
        return from(props);
    }

    /**
     * Obtain a configuration instance by loading the Properties from the supplied file.
     *
     * @param path the file containing the configuration properties; may not be null
     * @return the configuration; never null
     * @throws IOException if there is an error reading the file
     */
    static Configuration load(Path path) throws IOException {
        CONFIGURATION_LOGGER.debug("Loading configuration from '{}'", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    static Configuration load(Reader reader) throws IOException {
        Properties properties = new Properties();
        properties.load(reader);
        return from(properties);
    }

    /**
     * Obtain a configuration from environment variables that start with the given prefix. The prefix is removed, the
     * remainder lower-cased and every {@code _} replaced with {@code .}, so that with the prefix {@code SLOTLANDER_} the
     * variable {@code SLOTLANDER_SLOT_NAME} becomes the property {@code slot.name}.
     *
     * @param environment the environment variables, usually {@link System#getenv()}; may not be null
     * @param prefix the required prefix of the variable names; may not be null
     * @return the configuration; never null
     */
    static Configuration fromEnvironment(Map<String, String> environment, String prefix) {
        Properties props = new Properties();
        environment.forEach((name, value) -> {
            if (name.startsWith(prefix) && name.length() > prefix.length() && value != null) {
                String key = name.substring(prefix.length()).toLowerCase(Locale.ROOT).replace('_', '.');
                props.setProperty(key, value);
            }
        });
        return from(props);
    }

    /**
     * Get the set of keys in this configuration.
     *
     * @return the set of keys; never null but possibly empty
     */
    Set<String> keys();

    /**
     * Get the string value associated with the given key.
     *
     * @param key the key for the configuration property
     * @return the value, or null if the key is null or there is no such key-value pair in the configuration
     */
    String getString(String key);

    /**
     * Determine whether this configuration contains a key-value pair with the given key and the value is non-null
     *
     * @param key the key
     * @return true if the configuration contains the key, or false otherwise
     */
    default boolean hasKey(String key) {
        return getString(key) != null;
    }

    default boolean hasKey(Field field) {
        return hasKey(field.name());
    }

    default String getString(String key, Supplier<String> defaultValueSupplier) {
        String value = getString(key);
        return value != null ? value : (defaultValueSupplier != null ? defaultValueSupplier.get() : null);
    }

    /**
     * Get the string value associated with the given field, returning the field's default value if there is no such key-value
     * pair in this configuration.
     *
     * @param field the field; may not be null
     * @return the configuration's value for the field, or the field's {@link Field#defaultValue() default value} if there is no
     *         such key-value pair in the configuration
     */
    default String getString(Field field) {
        return getString(field.name(), field::defaultValueAsString);
    }

    /**
     * Get the integer value associated with the given field, returning the field's default value if there is no such
     * key-value pair.
     *
     * @param field the field
     * @return the integer value
     * @throws NumberFormatException if the value or the field's default value cannot be parsed as an integer
     */
    default int getInteger(Field field) {
        return Integer.parseInt(getString(field).trim());
    }

    /**
     * Get the long value associated with the given field, returning the field's default value if there is no such
     * key-value pair.
     *
     * @param field the field
     * @return the long value
     * @throws NumberFormatException if the value or the field's default value cannot be parsed as a long
     */
    default long getLong(Field field) {
        return Long.parseLong(getString(field).trim());
    }

    /**
     * Return a new {@link Configuration} that contains only the keys accepted by the supplied function, renamed by it.
     *
     * @param mapper the function that returns the new key for an existing key, or null if the key should be dropped
     * @return the filtered configuration; never null
     */
    default Configuration map(Function<String, String> mapper) {
        Properties props = new Properties();
        for (String key : keys()) {
            String newKey = mapper.apply(key);
            if (newKey != null) {
                props.setProperty(newKey, getString(key));
            }
        }
        return from(props);
    }

    /**
     * Return a copy of this configuration in which the values of all password-like keys are masked.
     *
     * @return the masked configuration; never null
     */
    default Configuration withMaskedPasswords() {
        Properties props = new Properties();
        for (String key : keys()) {
            String value = getString(key);
            props.setProperty(key, PASSWORD_PATTERN.matcher(key).matches() ? "********" : value);
        }
        return new Configuration() {
            @Override
            public Set<String> keys() {
                return props.stringPropertyNames();
            }

            @Override
            public String getString(String key) {
                return props.getProperty(key);
            }

            @Override
            public String toString() {
                return props.toString();
            }
        };
    }

    default Properties asProperties() {
        Properties props = new Properties();
        keys().forEach(key -> props.setProperty(key, getString(key)));
        return props;
    }

    /**
     * Validate the supplied fields in this configuration. Extra fields not described by the supplied {@code fields} parameter
     * are not validated.
     *
     * @param fields the fields
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    default boolean validate(Iterable<Field> fields, ValidationOutput problems) {
        boolean valid = true;
        for (Field field : fields) {
            if (!field.validate(this, problems)) {
                valid = false;
            }
        }
        return valid;
    }

    /**
     * Validate the supplied fields in this configuration, reporting each problem as a readable message.
     *
     * @param fields the fields
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    default boolean validateAndRecord(Iterable<Field> fields, Consumer<String> problems) {
        return validate(fields, (f, v, problem) -> {
            if (v == null) {
                problems.accept("The '" + f.name() + "' value is invalid: " + problem);
            }
            else {
                String valueStr = PASSWORD_PATTERN.matcher(f.name()).matches() ? "********" : "'" + v + "'";
                problems.accept("The '" + f.name() + "' value " + valueStr + " is invalid: " + problem);
            }
        });
    }
}
