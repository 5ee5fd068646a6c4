package com.flatline.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Flatline CLI 入口点（picocli）
 */
@Command(name = "flatline", version = "Flatline v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {ExpandCommand.class, CheckCommand.class, RunCommand.class})
public class Main implements Callable<Integer> {

    /** 持有引用，防止日志级别随 Logger 被回收而丢失 */
    private static final Logger FLATLINE = Logger.getLogger("com.flatline");

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return ExitCode.USAGE;
    }

    public static void main(String[] args) {
        configureLogging();
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * 从 classpath 加载 logging.properties
     */
    static void configureLogging() {
        InputStream in = Main.class.getResourceAsStream("/logging.properties");
        if (in == null) {
            return;
        }
        try {
            try {
                LogManager.getLogManager().readConfiguration(in);
            } finally {
                in.close();
            }
        } catch (IOException e) {
            System.err.println("警告: 无法加载日志配置 - " + e.getMessage());
        }
    }

    /**
     * --verbose：引擎输出每个调用点的处理过程
     */
    static void enableVerboseLogging() {
        FLATLINE.setLevel(Level.FINE);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            if (handler.getLevel().intValue() > Level.FINE.intValue()) {
                handler.setLevel(Level.FINE);
            }
        }
    }

    /**
     * 控制台实际使用的字符编码名；native.encoding 反映操作系统原生编码（Windows 控制台通常为 GBK）
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
