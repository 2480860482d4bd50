package me.golemcore.agent.adapter.outbound.storage;

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

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-file locking for history logs.
 *
 * <p>
 * OS file locks are held per JVM, so a second lock on the same file from
 * another thread fails with {@link OverlappingFileLockException} instead of
 * blocking. Each path therefore also gets an in-process read/write lock: writers
 * take both exclusively, readers take both on a best-effort basis and go ahead
 * unlocked when either is unavailable.
 */
@Slf4j
final class HistoryFileLocks {

    private final Map<Path, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    @FunctionalInterface
    interface IoAction<T> {
        T run() throws IOException;
    }

    <T> T exclusive(Path path, FileChannel channel, IoAction<T> action) throws IOException {
        ReentrantReadWriteLock lock = lockFor(path);
        lock.writeLock().lock();
        try (FileLock ignored = channel.lock()) {
            return action.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    <T> T sharedIfAvailable(Path path, FileChannel channel, IoAction<T> action) throws IOException {
        ReentrantReadWriteLock lock = lockFor(path);
        boolean local = lock.readLock().tryLock();
        try (FileLock ignored = local ? tryShared(path, channel) : null) {
            return action.run();
        } finally {
            if (local) {
                lock.readLock().unlock();
            }
        }
    }

    private FileLock tryShared(Path path, FileChannel channel) {
        try {
            return channel.tryLock(0L, Long.MAX_VALUE, true);
        } catch (OverlappingFileLockException | IOException e) {
            log.debug("[Storage] Shared lock unavailable for {}, reading unlocked: {}", path, e.getMessage());
            return null;
        }
    }

    private ReentrantReadWriteLock lockFor(Path path) {
        return locks.computeIfAbsent(path, p -> new ReentrantReadWriteLock());
    }
}
