package org.dumpsieve.options;

/**
 * Defines configuration option constants shared by the configuration loader and the CLI.
 */
public final class SieveOptions {

    private SieveOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        /**
         * Default profile name.
         */
        public static final String DEFAULT = "dev";

        /**
         * Profile environment variable name.
         */
        public static final String ENV_VAR = "DUMPSIEVE_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "dumpsieve.yaml";
    }

    /**
     * Deferral settings.
     */
    public static final class Defer {
        private Defer() {}

        /**
         * Defer every foreign key together with the indexes instead of keeping the
         * indexes they depend on.
         */
        public static final String CONSTRAINTS_KEY = "dumpsieve.defer.constraints";
        public static final boolean CONSTRAINTS_DEFAULT = false;
    }

    /**
     * Output settings.
     */
    public static final class Output {
        private Output() {}

        public static final String DIRECTORY_KEY = "dumpsieve.output.directory";

        public static final String CHARSET_KEY = "dumpsieve.output.charset";
        public static final String CHARSET_DEFAULT = "UTF-8";
    }
}
