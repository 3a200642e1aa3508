/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.project;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Files waiting to be analyzed, in order.
 *
 * <p>Nothing is taken off the queue while an include file is being read, so
 * a newly found include is linked into the graph before anything else is
 * analyzed. Once the queue runs empty with no reads outstanding, the idle
 * action runs, once per drain that analyzed something or had
 * {@link #markDirty()} called.
 *
 * <p>Not thread safe. Everything is expected to run on the analysis thread.
 */
final class AnalysisQueue {
    private static final Logger LOGGER = Logger.getLogger(AnalysisQueue.class.getName());

    record Item(AwkFile file, String text) {
    }

    private final Deque<Item> items = new ArrayDeque<>();
    private final Consumer<Item> analyzer;
    private final Runnable onIdle;
    private int outstandingReads;
    private boolean draining;
    private boolean dirty;

    /**
     * @param analyzer Analyzes a dequeued item
     * @param onIdle Runs when the queue goes idle after doing work
     */
    AnalysisQueue(Consumer<Item> analyzer, Runnable onIdle) {
        this.analyzer = analyzer;
        this.onIdle = onIdle;
    }

    /**
     * Queues {@code text} for analysis behind everything else. A file
     * already waiting keeps its place and gets the new text.
     *
     * @param file The file to analyze
     * @param text Its text
     */
    void addLast(AwkFile file, String text) {
        if (!replacePending(file, text)) {
            items.addLast(new Item(file, text));
        }
        drain();
    }

    /**
     * Queues {@code text} for analysis ahead of everything else.
     *
     * @param file The file to analyze
     * @param text Its text
     */
    void addFirst(AwkFile file, String text) {
        items.removeIf(item -> item.file() == file);
        items.addFirst(new Item(file, text));
        drain();
    }

    /**
     * Pauses the queue until the matching {@link #readFinished()}.
     */
    void readStarted() {
        outstandingReads++;
    }

    /**
     * Resumes the queue if no other read is outstanding.
     */
    void readFinished() {
        if (outstandingReads == 0) {
            LOGGER.severe("Include read finished without having started");
        } else {
            outstandingReads--;
        }
        drain();
    }

    /**
     * Makes the next drain run the idle action even if it analyzes nothing.
     */
    void markDirty() {
        dirty = true;
    }

    int outstandingReads() {
        return outstandingReads;
    }

    int size() {
        return items.size();
    }

    /**
     * Analyzes queued files until the queue is empty or a read is outstanding.
     * Calls made while draining only leave their work on the queue for the
     * running drain.
     */
    void drain() {
        if (draining) {
            return;
        }
        draining = true;
        try {
            do {
                while (outstandingReads == 0 && !items.isEmpty()) {
                    Item item = items.removeFirst();
                    dirty = true;
                    analyzer.accept(item);
                }
                if (outstandingReads == 0 && dirty) {
                    dirty = false;
                    onIdle.run();
                }
            } while (outstandingReads == 0 && !items.isEmpty());
        } finally {
            draining = false;
        }
    }

    private boolean replacePending(AwkFile file, String text) {
        Deque<Item> replaced = new ArrayDeque<>(items.size());
        boolean found = false;
        for (Item item : items) {
            if (!found && item.file() == file) {
                replaced.addLast(new Item(file, text));
                found = true;
            } else {
                replaced.addLast(item);
            }
        }
        if (found) {
            items.clear();
            items.addAll(replaced);
        }
        return found;
    }
}
