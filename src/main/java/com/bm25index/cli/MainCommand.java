package com.bm25index.cli;

import com.bm25index.config.ConfigException;
import com.bm25index.config.Constants;
import com.bm25index.config.IndexConfig;
import com.bm25index.index.IndexBuilder;
import com.bm25index.index.IndexReader;
import com.bm25index.index.IndexStats;
import com.bm25index.query.SearchHit;
import com.bm25index.query.SearchResult;
import com.bm25index.storage.IndexFormatException;
import com.bm25index.text.TokenizerType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "bm25",
    description = "🔍 紧凑 BM25 倒排索引：构建、检索与统计",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.BuildSubcommand.class,
        MainCommand.SearchSubcommand.class,
        MainCommand.StatsSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(MainCommand.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * 创建命令行解析器，枚举参数大小写不敏感。
     */
    static CommandLine createCommandLine() {
        return new CommandLine(new MainCommand()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 紧凑 BM25 倒排索引");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    static int sanitizeSearchLimit(int rawLimit) {
        if (rawLimit < 0) {
            System.err.printf("⚠️ limit=%d 非法，已使用 0%n", rawLimit);
            return 0;
        }
        if (rawLimit > Constants.MAX_SEARCH_LIMIT) {
            System.err.printf("⚠️ limit=%d 超过上限 %d，已自动限制%n", rawLimit, Constants.MAX_SEARCH_LIMIT);
            return Constants.MAX_SEARCH_LIMIT;
        }
        return rawLimit;
    }

    static String sanitizeQuery(CommandLine commandLine, String rawQuery) {
        if (rawQuery == null) {
            return "";
        }
        String trimmed = rawQuery.trim();
        if (trimmed.length() > Constants.MAX_QUERY_LENGTH) {
            throw new CommandLine.ParameterException(commandLine,
                "查询长度超过限制（最大 " + Constants.MAX_QUERY_LENGTH + " 字符）");
        }
        return trimmed;
    }

    static String toPrettyJson(Object value) throws IOException {
        return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }

    static void printStats(IndexStats stats) {
        System.out.println("   文档数: " + stats.numDocuments());
        System.out.println("   词条数: " + stats.numUniqueTerms());
        System.out.println("   倒排项: " + stats.totalPostings());
        System.out.printf("   平均长度: %.4f%n", stats.averageDocumentLength());
        System.out.printf("   k1=%.3f, b=%.3f%n", stats.k1(), stats.b());
    }

    @Command(name = "build", description = "📂 从 JSON 语料构建索引文件")
    static class BuildSubcommand implements Callable<Integer> {

        @Parameters(description = "JSON 语料：{\"键\": \"原文\"} 或 {\"键\": [\"词项\", ...]}", arity = "1")
        private Path corpusFile;

        @Option(names = {"-o", "--output"}, description = "索引输出文件", required = true)
        private Path outputFile;

        @Option(names = {"--config"}, description = "JSON 配置文件")
        private Path configFile;

        @Option(names = {"--k1"}, description = "词频饱和系数（默认 1.5）")
        private Double k1;

        @Option(names = {"--b"}, description = "长度归一化系数（默认 0.75）")
        private Double b;

        @Option(names = {"--tokenizer"}, description = "分词器 (whitespace|english)")
        private TokenizerType tokenizer;

        @Option(names = {"--stop-words"}, description = "english 分词器过滤停用词")
        private boolean stopWords;

        @Override
        public Integer call() {
            System.out.println("🚀 开始构建索引...");
            System.out.println("📂 语料: " + corpusFile);
            System.out.println("📁 输出: " + outputFile);
            try {
                IndexConfig config = resolveConfig();
                IndexBuilder<String> builder = IndexBuilder.create(config);
                long start = System.currentTimeMillis();
                int documentCount = new CorpusReader(OBJECT_MAPPER.getFactory()).readInto(corpusFile, builder);
                builder.build();
                builder.save(outputFile);
                long elapsed = System.currentTimeMillis() - start;

                System.out.println("✅ 构建完成！");
                System.out.println("📊 统计:");
                printStats(builder.getStats());
                System.out.println("   文件大小: " + Files.size(outputFile) + " B");
                System.out.println("   用时: " + elapsed + "ms");
                logger.debug("语料读取文档数: {}", documentCount);
                return 0;
            } catch (ConfigException exception) {
                System.err.println("❌ 配置非法: " + exception.getMessage());
                return 1;
            } catch (Exception exception) {
                System.err.println("❌ 构建失败: " + exception.getMessage());
                logger.error("构建索引失败: corpus={}", corpusFile, exception);
                return 1;
            }
        }

        /**
         * 配置文件提供基础值，命令行选项逐项覆盖。
         */
        IndexConfig resolveConfig() throws IOException {
            IndexConfig config = configFile == null ? IndexConfig.defaults() : IndexConfig.load(configFile);
            if (k1 != null) {
                config.setK1(k1);
            }
            if (b != null) {
                config.setB(b);
            }
            if (tokenizer != null) {
                config.setTokenizer(tokenizer);
            }
            if (stopWords) {
                config.setStopWords(true);
            }
            return config.validate();
        }
    }

    @Command(name = "search", description = "🔎 执行检索")
    static class SearchSubcommand implements Callable<Integer> {

        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @Parameters(index = "0", description = "索引文件")
        private Path indexFile;

        @Parameters(index = "1", description = "查询语句")
        private String query;

        @Option(names = {"-l", "--limit"}, description = "返回结果数量限制（默认取配置 topK）")
        private Integer limit;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Option(names = {"--config"}, description = "JSON 配置文件，与构建时共用以保证分词一致")
        private Path configFile;

        @Option(names = {"--tokenizer"}, description = "查询分词器，需与构建时一致 (whitespace|english)")
        private TokenizerType tokenizer;

        @Option(names = {"--stop-words"}, description = "english 分词器过滤停用词")
        private boolean stopWords;

        @Override
        public Integer call() {
            String safeQuery = sanitizeQuery(spec.commandLine(), query);
            try {
                IndexConfig config = resolveConfig();
                int safeLimit = sanitizeSearchLimit(limit != null ? limit : config.getTopK());
                IndexReader reader = new IndexReader(config.getTokenizer().create(config.isStopWords()));
                reader.load(indexFile);
                SearchResult result = reader.searchDetailed(safeQuery, safeLimit);

                if ("json".equalsIgnoreCase(format)) {
                    System.out.println(toPrettyJson(result));
                    return 0;
                }
                System.out.println("🔍 查询: \"" + safeQuery + "\"");
                System.out.println();
                printTextResult(result);
                System.out.println();
                System.out.println("📊 共 " + result.totalMatches() + " 条匹配，用时 " + result.elapsedMs() + "ms");
                return 0;
            } catch (ConfigException exception) {
                System.err.println("❌ 配置非法: " + exception.getMessage());
                return 1;
            } catch (IndexFormatException exception) {
                System.err.println("❌ 不是有效的索引文件: " + exception.getMessage());
                return 1;
            } catch (Exception exception) {
                System.err.println("❌ 搜索失败: " + exception.getMessage());
                logger.error("检索失败: index={}", indexFile, exception);
                return 1;
            }
        }

        IndexConfig resolveConfig() throws IOException {
            IndexConfig config = configFile == null ? IndexConfig.defaults() : IndexConfig.load(configFile);
            if (tokenizer != null) {
                config.setTokenizer(tokenizer);
            }
            if (stopWords) {
                config.setStopWords(true);
            }
            return config.validate();
        }

        private void printTextResult(SearchResult result) {
            if (result.hits().isEmpty()) {
                System.out.println("⚠️ 未找到匹配结果");
                return;
            }

            int rank = 1;
            for (SearchHit hit : result.hits()) {
                System.out.printf("%d. %s (score: %.4f)%n", rank++, hit.key(), hit.score());
            }
        }
    }

    @Command(name = "stats", description = "📊 查看索引统计信息")
    static class StatsSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "索引文件")
        private Path indexFile;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Override
        public Integer call() {
            try {
                IndexStats stats = IndexReader.open(indexFile).getStats();
                if ("json".equalsIgnoreCase(format)) {
                    System.out.println(toPrettyJson(stats.toMap()));
                    return 0;
                }
                System.out.println("📊 索引状态");
                System.out.println("═══════════");
                System.out.println("📁 索引文件: " + indexFile);
                printStats(stats);
                System.out.println("💾 索引大小: " + formatBytes(Files.size(indexFile)));
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format("%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }
}
