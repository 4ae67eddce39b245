package me.golemcore.conductor.domain.service;


/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admission control for tool bodies.
 *
 * <p>
 * Reads share a fair counting semaphore so at most {@code maxParallelReads}
 * run at once. Writes take a fair lock per resource key (usually the target
 * file path), so two writes to the same key never overlap while writes to
 * different keys proceed in parallel. Locks are created on first use and kept
 * for the scheduler's lifetime.
 *
 * <p>
 * Both paths release on success, failure and interruption. A thread
 * interrupted while waiting for admission never acquires, so it never leaks a
 * permit.
 */
@Slf4j
public class ToolScheduler {

    public static final int DEFAULT_MAX_PARALLEL_READS = 4;

    private final Semaphore readPermits;
    private final ConcurrentMap<String, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

    public ToolScheduler() {
        this(DEFAULT_MAX_PARALLEL_READS);
    }

    public ToolScheduler(int maxParallelReads) {
        if (maxParallelReads < 1) {
            throw new IllegalArgumentException("maxParallelReads must be >= 1, got " + maxParallelReads);
        }
        this.readPermits = new Semaphore(maxParallelReads, true);
    }

    public <T> T runRead(Callable<T> operation) throws Exception {
        readPermits.acquire();
        try {
            return operation.call();
        } finally {
            readPermits.release();
        }
    }

    public <T> T runWrite(String key, Callable<T> operation) throws Exception {
        ReentrantLock lock = writeLocks.computeIfAbsent(key, k -> new ReentrantLock(true));
        lock.lockInterruptibly();
        try {
            log.debug("[Tools] Write lock acquired: {}", key);
            return operation.call();
        } finally {
            lock.unlock();
        }
    }

    public int availableReadPermits() {
        return readPermits.availablePermits();
    }

    int writeLockCount() {
        return writeLocks.size();
    }
}
