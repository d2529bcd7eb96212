package com.lumenlang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lumen CLI 入口点（picocli）
 */
@Command(name = "lumen", version = "Lumen v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {ParseCommand.class, CheckCommand.class})
public class Main implements Runnable {

    /** 持有引用，避免 logger 配置被回收 */
    private static final Logger LUMEN_LOGGER = Logger.getLogger("com.lumenlang");

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "输出前端各阶段的调试日志")
    boolean verbose;

    @Override
    public void run() {
        // 未给出子命令
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * --verbose 时把 com.lumenlang 下的日志级别调到 FINE
     */
    void configureLogging() {
        if (!verbose || LUMEN_LOGGER.getLevel() == Level.FINE) {
            return;
        }
        LUMEN_LOGGER.setLevel(Level.FINE);
        Handler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        LUMEN_LOGGER.addHandler(handler);
    }

    public static CommandLine createCommandLine() {
        return new CommandLine(new Main());
    }

    public static void main(String[] args) {
        Charset console = consoleCharset();
        PrintStream out = new PrintStream(System.out, true, console);
        PrintStream err = new PrintStream(System.err, true, console);
        System.setOut(out);
        System.setErr(err);

        CommandLine cmd = createCommandLine();
        cmd.setOut(new PrintWriter(new OutputStreamWriter(out, console), true));
        cmd.setErr(new PrintWriter(new OutputStreamWriter(err, console), true));
        System.exit(cmd.execute(args));
    }

    /** 控制台编码：优先 native.encoding（JDK 17 起反映系统原生编码） */
    private static Charset consoleCharset() {
        String name = System.getProperty("native.encoding");
        return name != null && Charset.isSupported(name) ? Charset.forName(name) : Charset.defaultCharset();
    }
}
