/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.oocsi.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.util.ByteProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Decoder for OOCSI protocol lines.
 * Emits each newline-terminated line as a {@link String}, without its terminator.
 *
 * <p>Bytes of an unterminated line stay in the cumulation buffer until the rest of the line arrives, so a line
 * split across reads is never emitted in pieces. Empty lines are skipped. A line longer than the configured
 * maximum is discarded up to and including its terminator.
 */
public class OocsiLineDecoder extends ByteToMessageDecoder {
    private static final Logger log = LoggerFactory.getLogger(OocsiLineDecoder.class);

    public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024;

    private final int maxLineLength;
    private boolean discarding;
    private int discardedBytes;

    public OocsiLineDecoder() {
        this(DEFAULT_MAX_LINE_LENGTH);
    }

    public OocsiLineDecoder(int maxLineLength) {
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
        }
        this.maxLineLength = maxLineLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        int eol = in.forEachByte(ByteProcessor.FIND_LF);

        if (eol < 0) {
            // No terminator yet; one extra byte may be the CR of a CRLF
            if (in.readableBytes() > maxLineLength + 1) {
                discardedBytes += in.readableBytes();
                in.skipBytes(in.readableBytes());
                discarding = true;
            }
            return;
        }

        int terminated = eol - in.readerIndex();
        int length = terminated;
        if (length > 0 && in.getByte(eol - 1) == '\r') {
            length--;
        }
        if (discarding || length > maxLineLength) {
            log.debug("Discarding line of {} bytes exceeding the limit of {}", discardedBytes + length, maxLineLength);
            in.skipBytes(terminated + 1);
            discarding = false;
            discardedBytes = 0;
            return;
        }

        String line = in.toString(in.readerIndex(), length, StandardCharsets.UTF_8);
        in.skipBytes(eol - in.readerIndex() + 1);

        if (!line.isEmpty()) {
            log.trace("Decoded line: {}", line);
            out.add(line);
        }
    }
}
