/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.jump.core.treesitter;

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJava;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterTypescript;
import ru.nts.tools.jump.engine.SyntaxTree;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.zip.CRC32C;

/**
 * Менеджер tree-sitter парсеров.
 * Держит загруженные грамматики, парсеры по потокам и кэш деревьев по пути документа.
 * Thread-safe через ThreadLocal парсеров.
 */
public final class TreeSitterManager {

    private static final TreeSitterManager INSTANCE = new TreeSitterManager();

    /**
     * Кэшированные TSLanguage объекты (потокобезопасные, можно переиспользовать).
     */
    private final Map<String, TSLanguage> languages = new ConcurrentHashMap<>();

    /**
     * ThreadLocal парсеры для каждого языка (TSParser не thread-safe).
     */
    private final Map<String, ThreadLocal<TSParser>> parsers = new ConcurrentHashMap<>();

    /**
     * Кэш деревьев с CRC содержимого для инвалидации.
     */
    private final Map<Path, CachedTree> treeCache = new ConcurrentHashMap<>();

    private static final int MAX_CACHE_SIZE = 100;

    /**
     * Файлы с бОльшим количеством строк не кэшируются.
     */
    private static final int MAX_LINES_FOR_CACHING = 10_000;

    private TreeSitterManager() {}

    public static TreeSitterManager getInstance() {
        return INSTANCE;
    }

    /**
     * Получает TSLanguage для указанного языка. Грамматика загружается при первом обращении.
     *
     * @throws IllegalArgumentException если язык не поддерживается
     */
    public TSLanguage getLanguage(String langId) {
        return languages.computeIfAbsent(langId, this::loadLanguage);
    }

    private TSLanguage loadLanguage(String langId) {
        return switch (langId) {
            case "java" -> new TreeSitterJava();
            case "javascript" -> new TreeSitterJavascript();
            case "typescript" -> new TreeSitterTypescript();
            case "tsx" -> new TreeSitterTypescript();  // TSX uses TypeScript parser
            case "python" -> new TreeSitterPython();
            default -> throw new IllegalArgumentException("Unsupported language: " + langId);
        };
    }

    private TSParser getParser(String langId) {
        ThreadLocal<TSParser> parserHolder = parsers.computeIfAbsent(langId,
                k -> ThreadLocal.withInitial(() -> {
                    TSParser parser = new TSParser();
                    parser.setLanguage(getLanguage(k));
                    return parser;
                }));
        return parserHolder.get();
    }

    /**
     * Парсит строку содержимого.
     *
     * @throws IllegalArgumentException если язык не поддерживается
     * @throws IllegalStateException    если парсер не вернул дерево
     */
    public TSTree parse(String content, String langId) {
        TSParser parser = getParser(langId);
        TSTree tree = parser.parseString(null, content);
        if (tree == null) {
            throw new IllegalStateException("Failed to parse content for language: " + langId);
        }
        return tree;
    }

    /**
     * Возвращает дерево документа из кэша или разбирает содержимое заново.
     * Кэш инвалидируется, если CRC содержимого изменился.
     *
     * @param path    путь к документу (ключ кэша)
     * @param content текущее содержимое
     * @param langId  идентификатор языка
     */
    public ParseResult getCachedOrParse(Path path, String content, String langId) {
        Path normalizedPath = path.toAbsolutePath().normalize();
        long currentCrc = calculateCrc(content);

        CachedTree cached = treeCache.get(normalizedPath);
        if (cached != null && cached.crc32c == currentCrc && cached.langId.equals(langId)) {
            return new ParseResult(cached.tree, content, langId, currentCrc);
        }

        TSTree tree = parse(content, langId);

        if (countLines(content) <= MAX_LINES_FOR_CACHING) {
            if (treeCache.size() >= MAX_CACHE_SIZE) {
                evictOldestEntries(MAX_CACHE_SIZE / 4);
            }
            treeCache.put(normalizedPath, new CachedTree(tree, currentCrc, Instant.now(), langId));
        }

        return new ParseResult(tree, content, langId, currentCrc);
    }

    public void invalidateCache(Path path) {
        treeCache.remove(path.toAbsolutePath().normalize());
    }

    public void clearCache() {
        treeCache.clear();
    }

    public int getCacheSize() {
        return treeCache.size();
    }

    private int countLines(String content) {
        if (content == null || content.isEmpty()) return 0;
        int lines = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') lines++;
        }
        return lines;
    }

    private long calculateCrc(String content) {
        CRC32C crc = new CRC32C();
        crc.update(content.getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }

    private void evictOldestEntries(int count) {
        treeCache.entrySet().stream()
                .sorted((a, b) -> a.getValue().parsedAt.compareTo(b.getValue().parsedAt))
                .limit(count)
                .forEach(entry -> treeCache.remove(entry.getKey()));
    }

    private record CachedTree(TSTree tree, long crc32c, Instant parsedAt, String langId) {}

    /**
     * Результат парсинга с контентом.
     */
    public record ParseResult(TSTree tree, String content, String langId, long crc32c) {

        /**
         * Оборачивает нативное дерево в синтаксическое дерево движка навигации.
         */
        public SyntaxTree toSyntaxTree() {
            return TsSyntaxNode.treeOf(tree, content, langId);
        }
    }
}
