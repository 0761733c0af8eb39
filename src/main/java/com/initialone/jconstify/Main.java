package com.initialone.jconstify;

import com.initialone.jconstify.commands.ExtractCmd;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int code = newCommandLine().execute(args);
        System.exit(code);
    }

    public static CommandLine newCommandLine() {
        return new CommandLine(new ExtractCmd());
    }
}
