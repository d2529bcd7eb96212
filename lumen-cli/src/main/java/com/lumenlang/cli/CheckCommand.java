package com.lumenlang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * picocli check 子命令：解析并类型检查，成功时打印程序类型
 */
@Command(name = "check", description = "类型检查源码文件")
public class CheckCommand implements Callable<Integer> {

    @ParentCommand
    Main parent;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "源码文件路径（.lm）")
    String file;

    @Override
    public Integer call() {
        parent.configureLogging();
        return new SourceRunner(spec.commandLine().getOut(), spec.commandLine().getErr()).checkFile(file);
    }
}
