package cli;

import app.AcsTablesCliApp;

/**
 * CLI entrypoint facade. Exit codes: 0 ok, 1 a state built no tables, 2 fatal input error.
 */
public class AcsTablesCli {

    public static void main(String[] args) {
        System.exit(AcsTablesCliApp.run(args));
    }
}
