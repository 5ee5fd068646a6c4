package com.flatline.cli;

import com.flatline.compiler.ast.decl.Program;
import com.flatline.compiler.parser.ParseException;
import com.flatline.engine.template.TemplateLibrary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 模板库缓存测试
 */
class TemplateLibraryCacheTest {

    @TempDir
    Path dir;

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    @DisplayName("未改动的文件命中缓存")
    void testHit() throws IOException {
        TemplateLibraryCache cache = new TemplateLibraryCache(4);
        Path lib = write("lib.fl", MainTest.LIBRARY);

        Program first = cache.load(lib);
        Program second = cache.load(lib);

        assertSame(first, second);
        assertEquals(1, cache.hitCount());
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("并发加载同一个库只解析一次")
    void testConcurrentLoad() throws Exception {
        final TemplateLibraryCache cache = new TemplateLibraryCache(4);
        final Path lib = write("lib.fl", MainTest.LIBRARY);
        final CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Program>> futures = new ArrayList<Future<Program>>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return cache.load(lib);
                }));
            }
            start.countDown();
            Program first = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<Program> future : futures) {
                assertSame(first, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("文件改动后重新解析")
    void testReparseAfterChange() throws IOException {
        TemplateLibraryCache cache = new TemplateLibraryCache(4);
        Path lib = write("lib.fl", MainTest.LIBRARY);
        Program first = cache.load(lib);

        write("lib.fl", MainTest.LIBRARY + "inline fun twice(x: Int): Int = x + x\n");
        Program second = cache.load(lib);

        assertNotSame(first, second);
        assertNotNull(second.findFunction("twice"));
        assertEquals(0, cache.hitCount());
    }

    @Test
    @DisplayName("多个库文件合并为一个模板库")
    void testLibrary() throws IOException {
        TemplateLibraryCache cache = new TemplateLibraryCache(4);
        Path a = write("a.fl", MainTest.LIBRARY);
        Path b = write("b.fl", "inline fun twice(x: Int): Int = x + x\n");

        TemplateLibrary library = cache.library(Arrays.asList(a, b));

        assertEquals(2, library.getPrograms().size());
        assertThat(library.getDiagnostics()).isEmpty();
    }

    @Test
    @DisplayName("clear 清空缓存")
    void testClear() throws IOException {
        TemplateLibraryCache cache = new TemplateLibraryCache(4);
        cache.load(write("lib.fl", MainTest.LIBRARY));
        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("异常")
    void testErrors() throws IOException {
        TemplateLibraryCache cache = new TemplateLibraryCache(4);
        Path broken = write("broken.fl", "inline fun (");

        assertThrows(ParseException.class, () -> cache.load(broken));
        assertThrows(NoSuchFileException.class, () -> cache.load(dir.resolve("missing.fl")));
        assertThrows(IllegalArgumentException.class, () -> new TemplateLibraryCache(0));
        assertEquals(0, cache.size());
    }
}
