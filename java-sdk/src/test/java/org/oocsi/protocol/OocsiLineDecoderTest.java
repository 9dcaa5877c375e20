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
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OocsiLineDecoderTest {

    private EmbeddedChannel channel;

    @AfterEach
    void tearDown() {
        if (channel != null) {
            channel.finishAndReleaseAll();
        }
    }

    private static ByteBuf bytes(String text) {
        return Unpooled.copiedBuffer(text, StandardCharsets.UTF_8);
    }

    @Nested
    class CompleteLines {

        @Test
        void shouldDecodeSingleLine() {
            // given
            channel = new EmbeddedChannel(new OocsiLineDecoder());

            // when
            channel.writeInbound(bytes("ping\n"));

            // then
            assertThat((String) channel.readInbound()).isEqualTo("ping");
            assertThat((Object) channel.readInbound()).isNull();
        }

        @Test
        void shouldDecodeSeveralLinesFromOneChunk() {
            // given
            channel = new EmbeddedChannel(new OocsiLineDecoder());

            // when
            channel.writeInbound(bytes("{\"a\":1}\n.\n{\"b\":2}\n"));

            // then
            assertThat((String) channel.readInbound()).isEqualTo("{\"a\":1}");
            assertThat((String) channel.readInbound()).isEqualTo(".");
            assertThat((String) channel.readInbound()).isEqualTo("{\"b\":2}");
        }

        @Test
        void shouldStripCarriageReturn() {
            // given
            channel = new EmbeddedChannel(new OocsiLineDecoder());

            // when
            channel.writeInbound(bytes("{\"a\":1}\r\n"));

            // then
            assertThat((String) channel.readInbound()).isEqualTo("{\"a\":1}");
        }

        @Test
        void shouldSkipEmptyLines() {
            // given
            channel = new EmbeddedChannel(new OocsiLineDecoder());

            // when
            channel.writeInbound(bytes("\n\r\nping\n"));

            // then
            assertThat((String) channel.readInbound()).isEqualTo("ping");
            assertThat((Object) channel.readInbound()).isNull();
        }

        @Test
        void shouldDecodeMultiByteCharacters() {
            // given
            channel = new EmbeddedChannel(new OocsiLineDecoder());

            // when
            channel.writeInbound(bytes("{\"city\":\"Eindhoven ☀\"}\n"));

            // then
            assertThat((String) channel.readInbound()).isEqualTo("{\"city\":\"Eindhoven ☀\"}");
        }
    }

    @Nested
    class PartialLines {

        @Test
        void shouldBufferLineSplitAcrossChunks() {
            // given
            channel = new EmbeddedChannel(new OocsiLineDecoder());

            // when
            channel.writeInbound(bytes("{\"temp"));
            Object beforeTerminator = channel.readInbound();
            channel.writeInbound(bytes("erature\":21}\n"));

            // then
            assertThat(beforeTerminator).isNull();
            assertThat((String) channel.readInbound()).isEqualTo("{\"temperature\":21}");
        }

        @Test
        void shouldKeepTrailingPartialLineForNextChunk() {
            // given
            channel = new EmbeddedChannel(new OocsiLineDecoder());

            // when
            channel.writeInbound(bytes("ping\n{\"x\""));
            String first = channel.readInbound();
            Object pending = channel.readInbound();
            channel.writeInbound(bytes(":true}\n"));

            // then
            assertThat(first).isEqualTo("ping");
            assertThat(pending).isNull();
            assertThat((String) channel.readInbound()).isEqualTo("{\"x\":true}");
        }

        @Test
        void shouldDecodeCharacterSplitBetweenChunks() {
            // given
            channel = new EmbeddedChannel(new OocsiLineDecoder());
            byte[] encoded = "é\n".getBytes(StandardCharsets.UTF_8);

            // when
            channel.writeInbound(Unpooled.wrappedBuffer(encoded, 0, 1));
            channel.writeInbound(Unpooled.wrappedBuffer(encoded, 1, encoded.length - 1));

            // then
            assertThat((String) channel.readInbound()).isEqualTo("é");
        }
    }

    @Nested
    class OverlongLines {

        @Test
        void shouldDiscardLineLongerThanLimit() {
            // given
            channel = new EmbeddedChannel(new OocsiLineDecoder(8));

            // when
            channel.writeInbound(bytes("0123456789\nping\n"));

            // then
            assertThat((String) channel.readInbound()).isEqualTo("ping");
            assertThat((Object) channel.readInbound()).isNull();
        }

        @Test
        void shouldDiscardOverlongLineArrivingInChunks() {
            // given
            channel = new EmbeddedChannel(new OocsiLineDecoder(8));

            // when
            channel.writeInbound(bytes("0123456789"));
            channel.writeInbound(bytes("abc\n."));
            channel.writeInbound(bytes("\n"));

            // then
            assertThat((String) channel.readInbound()).isEqualTo(".");
            assertThat((Object) channel.readInbound()).isNull();
        }

        @Test
        void shouldKeepLineAtLimitTerminatedByCrLf() {
            // given
            channel = new EmbeddedChannel(new OocsiLineDecoder(8));

            // when
            channel.writeInbound(bytes("01234567\r\n"));

            // then
            assertThat((String) channel.readInbound()).isEqualTo("01234567");
        }

        @Test
        void shouldKeepLineAtLimitWhenCrLfIsSplitAcrossChunks() {
            // given
            channel = new EmbeddedChannel(new OocsiLineDecoder(8));

            // when
            channel.writeInbound(bytes("01234567\r"));
            channel.writeInbound(bytes("\nping\n"));

            // then
            assertThat((String) channel.readInbound()).isEqualTo("01234567");
            assertThat((String) channel.readInbound()).isEqualTo("ping");
        }

        @Test
        void shouldDiscardLineOneByteOverLimitWithCrLf() {
            // given
            channel = new EmbeddedChannel(new OocsiLineDecoder(8));

            // when
            channel.writeInbound(bytes("012345678\r\nping\n"));

            // then
            assertThat((String) channel.readInbound()).isEqualTo("ping");
            assertThat((Object) channel.readInbound()).isNull();
        }

        @Test
        void shouldRejectNonPositiveLimit() {
            assertThatThrownBy(() -> new OocsiLineDecoder(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
