package com.lumenlang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * picocli parse 子命令：打印 AST 的 s-expression 形式
 */
@Command(name = "parse", description = "解析源码文件并打印语法树")
public class ParseCommand implements Callable<Integer> {

    @ParentCommand
    Main parent;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "源码文件路径（.lm）")
    String file;

    @Override
    public Integer call() {
        parent.configureLogging();
        return new SourceRunner(spec.commandLine().getOut(), spec.commandLine().getErr()).parseFile(file);
    }
}
