package com.configlens.cli;

import com.configlens.config.Constants;
import com.configlens.config.RenderConfig;
import com.configlens.document.DocumentLoader;
import com.configlens.document.Node;
import com.configlens.provenance.InMemoryProvenanceStore;
import com.configlens.provenance.ProvenanceLoader;
import com.configlens.provenance.ProvenanceStore;
import com.configlens.render.ProvenanceRenderers;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "config-lens",
    description = "🔍 配置值来源追踪：查看合并后每个值来自哪个文件、哪一行、第几层继承",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.TreeSubcommand.class,
        MainCommand.SideBySideSubcommand.class,
        MainCommand.InlineSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    private static final int MAX_INDENT_WIDTH = 9;

    @Option(names = {"-p", "--provenance"}, description = "来源记录 JSON 文件（缺省时不做标注）")
    private Path provenanceFile;

    @Option(names = {"--indent"}, description = "YAML 缩进宽度", defaultValue = "2")
    private int indent;

    @Option(names = {"--comment-column"}, description = "注释列（缺省按终端宽度计算）")
    private Integer commentColumn;

    @Option(names = {"--root-label"}, description = "来源树根标签", defaultValue = Constants.DEFAULT_ROOT_LABEL)
    private String rootLabel;

    @Option(names = {"--no-color"}, description = "关闭颜色输出")
    private boolean noColor;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 配置值来源追踪工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    private int resolveIndent() {
        if (indent < 2) {
            System.err.printf("⚠️ 非法缩进 %d，已回退为默认值 %d%n", indent, Constants.DEFAULT_INDENT_WIDTH);
            return Constants.DEFAULT_INDENT_WIDTH;
        }
        if (indent > MAX_INDENT_WIDTH) {
            System.err.printf("⚠️ 缩进 %d 超过上限 %d，已自动限制%n", indent, MAX_INDENT_WIDTH);
            return MAX_INDENT_WIDTH;
        }
        return indent;
    }

    private int resolveCommentColumn() {
        if (commentColumn == null) {
            return TerminalWidth.commentColumn(TerminalWidth.detect());
        }
        if (commentColumn < Constants.MIN_COMMENT_COLUMN) {
            System.err.printf("⚠️ 注释列 %d 小于下限 %d，已自动调整%n", commentColumn, Constants.MIN_COMMENT_COLUMN);
            return Constants.MIN_COMMENT_COLUMN;
        }
        return commentColumn;
    }

    RenderConfig buildConfig() {
        RenderConfig config = RenderConfig.defaults();
        config.setIndentWidth(resolveIndent());
        config.setCommentColumn(resolveCommentColumn());
        config.setRootLabel(rootLabel);
        config.setColorEnabled(!noColor);
        return config;
    }

    ProvenanceStore loadStore() throws IOException {
        if (provenanceFile == null) {
            return new InMemoryProvenanceStore(false);
        }
        return new ProvenanceLoader().load(provenanceFile);
    }

    @Command(name = "tree", description = "🌳 按源文件分组列出每个路径的来源")
    static class TreeSubcommand implements Callable<Integer> {

        @Option(names = {"--path"}, description = "只显示这些路径（可指定多个）")
        private List<String> paths;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                ProvenanceStore store = main.loadStore();
                if (!store.isProvenanceEnabled()) {
                    System.err.println("⚠️ 未启用来源追踪，请通过 --provenance 指定来源文件");
                    return 1;
                }
                ProvenanceRenderers renderers = new ProvenanceRenderers(main.buildConfig());
                System.out.print(renderers.renderTree(store, paths == null ? null : new LinkedHashSet<>(paths)));
                return 0;
            } catch (IOException exception) {
                System.err.println("❌ 读取来源失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "side-by-side", description = "📑 左侧配置、右侧来源树并排显示")
    static class SideBySideSubcommand implements Callable<Integer> {

        @Parameters(description = "合并后的文档（YAML 或 JSON）", arity = "1")
        private Path document;

        @Option(names = {"-w", "--width"}, description = "左栏宽度",
                defaultValue = "" + Constants.DEFAULT_LEFT_WIDTH)
        private int width;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            if (width <= Constants.LEFT_COLUMN_GUTTER) {
                System.err.printf("⚠️ 左栏宽度 %d 非法，已使用默认值 %d%n", width, Constants.DEFAULT_LEFT_WIDTH);
                width = Constants.DEFAULT_LEFT_WIDTH;
            }
            try {
                Node node = new DocumentLoader().load(document);
                ProvenanceStore store = main.loadStore();
                ProvenanceRenderers renderers = new ProvenanceRenderers(main.buildConfig());
                System.out.print(renderers.renderSideBySide(node, store, width));
                return 0;
            } catch (IOException exception) {
                System.err.println("❌ 读取输入失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "inline", description = "📝 在每个键行后追加来源注释")
    static class InlineSubcommand implements Callable<Integer> {

        @Parameters(description = "合并后的文档（YAML 或 JSON）", arity = "1")
        private Path document;

        @Option(names = {"--stack"}, description = "被描述的清单文件，显示在图例之后")
        private String stackFile;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                Node node = new DocumentLoader().load(document);
                ProvenanceStore store = main.loadStore();
                ProvenanceRenderers renderers = new ProvenanceRenderers(main.buildConfig());
                System.out.print(renderers.renderInline(node, store, stackFile));
                return 0;
            } catch (IOException exception) {
                System.err.println("❌ 读取输入失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
