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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Reads the last records of a line-delimited log by scanning it backwards in
 * fixed-size blocks.
 *
 * <p>
 * Bytes are split on {@code '\n'} before charset decoding, which is safe for
 * UTF-8 because the newline byte never occurs inside a multi-byte sequence. The
 * bytes left of the first newline in a block are carried over to the next
 * (earlier) block, since their line may start there. Reading stops as soon as
 * {@code lastN} records decoded successfully, so the bytes read are bounded by
 * the size of those records plus one block.
 */
final class JsonlTailReader {

    private static final byte NEWLINE = '\n';

    private JsonlTailReader() {
    }

    /**
     * @param decoder
     *            returns the decoded record, or {@code null} for a malformed line
     */
    static <T> TailReadResult<T> readLast(FileChannel channel, int lastN, int blockSize,
            Function<String, T> decoder) throws IOException {
        List<T> newestFirst = new ArrayList<>();
        DecodeStats stats = new DecodeStats();
        if (lastN <= 0) {
            return new TailReadResult<>(newestFirst, 0, stats);
        }

        long position = channel.size();
        long bytesRead = 0;
        byte[] carry = new byte[0];

        while (position > 0 && newestFirst.size() < lastN) {
            int chunkSize = (int) Math.min(blockSize, position);
            position -= chunkSize;

            ByteBuffer buffer = ByteBuffer.allocate(chunkSize);
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position + buffer.position());
                if (read < 0) {
                    break;
                }
            }
            int filled = buffer.position();
            bytesRead += filled;

            byte[] block = new byte[filled + carry.length];
            System.arraycopy(buffer.array(), 0, block, 0, filled);
            System.arraycopy(carry, 0, block, filled, carry.length);

            int end = block.length;
            for (int i = block.length - 1; i >= 0 && newestFirst.size() < lastN; i--) {
                if (block[i] == NEWLINE) {
                    decodeLine(block, i + 1, end, decoder, newestFirst, stats);
                    end = i;
                }
            }
            carry = Arrays.copyOf(block, end);
        }

        // First line of the file has no newline in front of it
        if (position == 0 && newestFirst.size() < lastN && carry.length > 0) {
            decodeLine(carry, 0, carry.length, decoder, newestFirst, stats);
        }

        Collections.reverse(newestFirst);
        return new TailReadResult<>(newestFirst, bytesRead, stats);
    }

    private static <T> void decodeLine(byte[] bytes, int start, int end, Function<String, T> decoder,
            List<T> sink, DecodeStats stats) {
        if (end <= start) {
            return;
        }
        String line = new String(bytes, start, end - start, StandardCharsets.UTF_8).strip();
        if (line.isEmpty()) {
            return;
        }
        T record = decoder.apply(line);
        if (record == null) {
            stats.recordMalformed(line);
            return;
        }
        sink.add(record);
    }

    /**
     * Records in chronological order plus read diagnostics.
     */
    record TailReadResult<T>(List<T> records, long bytesRead, DecodeStats stats) {
    }
}
