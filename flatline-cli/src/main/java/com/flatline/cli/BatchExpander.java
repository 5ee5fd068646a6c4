package com.flatline.cli;

import com.flatline.engine.ExpansionEngine;
import com.flatline.engine.ExpansionResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * 批量展开：每个文件在固定大小的线程池上独立展开，全部完成后按输入顺序返回
 */
public final class BatchExpander {

    private static final Logger LOG = Logger.getLogger(BatchExpander.class.getName());

    private final ExpansionEngine engine;
    private final int threads;

    /**
     * @param threads 线程数；不大于 0 时取处理器数
     */
    public BatchExpander(ExpansionEngine engine, int threads) {
        this.engine = engine;
        this.threads = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }

    public List<UnitOutcome> expandAll(List<Path> files) throws InterruptedException {
        List<UnitOutcome> outcomes = new ArrayList<UnitOutcome>();
        if (files.isEmpty()) {
            return outcomes;
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, files.size()), r -> {
            Thread t = new Thread(r, "flatline-expand");
            t.setDaemon(true);
            return t;
        });
        try {
            List<Callable<UnitOutcome>> tasks = new ArrayList<Callable<UnitOutcome>>();
            for (final Path file : files) {
                tasks.add(() -> expandOne(file));
            }
            for (Future<UnitOutcome> future : pool.invokeAll(tasks)) {
                outcomes.add(future.get());
            }
        } catch (ExecutionException e) {
            throw new IllegalStateException("Expansion task failed", e.getCause());
        } finally {
            pool.shutdown();
        }
        LOG.fine("Expanded " + files.size() + " files on " + Math.min(threads, files.size()) + " threads");
        return outcomes;
    }

    private UnitOutcome expandOne(Path file) {
        String source;
        try {
            source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warning("Cannot read " + file + ": " + e);
            return UnitOutcome.unreadable(file, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        ExpansionResult result = engine.expandSource(source, file.getFileName().toString());
        return UnitOutcome.expanded(file, result);
    }
}
