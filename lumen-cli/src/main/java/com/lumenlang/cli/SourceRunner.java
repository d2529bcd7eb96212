package com.lumenlang.cli;

import com.lumenlang.compiler.ast.AstPrinter;
import com.lumenlang.compiler.compiler.CheckResult;
import com.lumenlang.compiler.compiler.LumenFrontend;
import com.lumenlang.compiler.parser.ParseException;
import com.lumenlang.compiler.compiler.Diagnostic;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * parse / check 执行器：读取源文件，调用前端，输出结果并给出退出码
 */
public class SourceRunner {

    private static final Logger LOG = Logger.getLogger(SourceRunner.class.getName());

    public static final int EXIT_OK = 0;
    public static final int EXIT_COMPILE_ERROR = 1;
    public static final int EXIT_IO_ERROR = 2;

    private final LumenFrontend frontend = new LumenFrontend();
    private final PrintWriter out;
    private final PrintWriter err;

    public SourceRunner(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 解析文件并打印 AST
     */
    public int parseFile(String filePath) {
        Path path = Paths.get(filePath);
        String source = readSource(path);
        if (source == null) {
            return EXIT_IO_ERROR;
        }

        try {
            out.println(AstPrinter.print(frontend.parse(source, filePath)));
            return EXIT_OK;
        } catch (ParseException e) {
            err.println(new Diagnostic(Diagnostic.Kind.SYNTAX, e.getRawMessage(), e.getLocation()).format());
            return EXIT_COMPILE_ERROR;
        }
    }

    /**
     * 解析并类型检查文件
     */
    public int checkFile(String filePath) {
        Path path = Paths.get(filePath);
        String source = readSource(path);
        if (source == null) {
            return EXIT_IO_ERROR;
        }

        CheckResult result = frontend.check(source, filePath);
        if (result.isSuccess()) {
            out.println("OK: " + result.getType());
            return EXIT_OK;
        }
        err.println(result.getDiagnostic().format());
        return EXIT_COMPILE_ERROR;
    }

    private String readSource(Path path) {
        if (!Files.isRegularFile(path)) {
            err.println("error: file not found - " + path);
            return null;
        }
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "读取源文件失败: " + path, e);
            err.println("error: cannot read " + path + ": " + e.getMessage());
            return null;
        }
    }
}
