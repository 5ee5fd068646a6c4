package com.flatline.cli;

import com.flatline.compiler.ast.decl.Program;
import com.flatline.compiler.parser.Parser;
import com.flatline.engine.template.TemplateLibrary;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * 模板库解析缓存（Caffeine）
 *
 * <p>键为文件的绝对路径、大小与修改时间，文件改动后自然失效。
 * 多个编译单元共享同一个库时只解析一次。线程安全。</p>
 */
public final class TemplateLibraryCache {

    private static final Logger LOG = Logger.getLogger(TemplateLibraryCache.class.getName());

    private static final TemplateLibraryCache SHARED = new TemplateLibraryCache(64);

    private final Cache<Key, Program> cache;

    /**
     * @param maximumSize 最多缓存的库文件数
     */
    public TemplateLibraryCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    /** 进程内共享的实例 */
    public static TemplateLibraryCache shared() {
        return SHARED;
    }

    /**
     * 读取并解析一个库文件，命中缓存时直接返回
     *
     * @throws IOException 文件无法读取
     * @throws com.flatline.compiler.parser.ParseException 文件无法解析
     */
    public Program load(final Path path) throws IOException {
        Key key = Key.of(path);
        try {
            // 同一个键只解析一次，并发加载的线程等待同一个结果
            return cache.get(key, k -> parse(path));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static Program parse(Path path) {
        String source;
        try {
            source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        Program program = Parser.parseSource(source, path.getFileName().toString());
        LOG.fine("Parsed template library " + path);
        return program;
    }

    public TemplateLibrary library(List<Path> paths) throws IOException {
        List<Program> programs = new ArrayList<Program>();
        for (Path path : paths) {
            programs.add(load(path));
        }
        return new TemplateLibrary(programs);
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long size() {
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    private static final class Key {
        private final String path;
        private final long size;
        private final long modified;

        private Key(String path, long size, long modified) {
            this.path = path;
            this.size = size;
            this.modified = modified;
        }

        static Key of(Path path) throws IOException {
            Path absolute = path.toAbsolutePath().normalize();
            return new Key(absolute.toString(), Files.size(absolute),
                    Files.getLastModifiedTime(absolute).toMillis());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return size == other.size && modified == other.modified && path.equals(other.path);
        }

        @Override
        public int hashCode() {
            return Objects.hash(path, size, modified);
        }
    }
}
