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

package org.oocsi.testing;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Minimal line server for client tests. Serves one connection at a time: answers the handshake with the
 * configured response and records every later line.
 */
public final class FakeOocsiServer implements AutoCloseable {

    public static final String WELCOME = "{\"message\":\"welcome\"}";

    private final ServerSocket serverSocket;
    private final Thread acceptor;
    private final BlockingQueue<String> received = new LinkedBlockingQueue<>();
    private final List<String> history = new CopyOnWriteArrayList<>();
    private final BlockingQueue<String> handshakes = new LinkedBlockingQueue<>();
    private final AtomicInteger handshakeCount = new AtomicInteger();
    private volatile String handshakeResponse = WELCOME;
    private volatile Socket client;

    public FakeOocsiServer() throws IOException {
        serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        acceptor = new Thread(this::acceptLoop, "fake-oocsi-server");
        acceptor.setDaemon(true);
        acceptor.start();
    }

    public int port() {
        return serverSocket.getLocalPort();
    }

    public void respondToHandshakeWith(String response) {
        this.handshakeResponse = response;
    }

    public String awaitHandshake() throws InterruptedException {
        return handshakes.poll(5, TimeUnit.SECONDS);
    }

    /**
     * Number of handshakes received since the server started, awaited or not.
     */
    public int handshakeCount() {
        return handshakeCount.get();
    }

    /**
     * Waits for the next line received after the handshake.
     */
    public String awaitLine() throws InterruptedException {
        return received.poll(5, TimeUnit.SECONDS);
    }

    /**
     * Waits for the next received line starting with the given prefix, skipping others.
     */
    public String awaitLineStartingWith(String prefix) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            String line = received.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
            if (line != null && line.startsWith(prefix)) {
                return line;
            }
        }
        return null;
    }

    /**
     * Whether the line was received at any time, regardless of what was awaited since.
     */
    public boolean hasReceived(String line) {
        return history.contains(line);
    }

    public void send(String line) {
        Socket socket = client;
        if (socket == null) {
            throw new IllegalStateException("No client connected");
        }
        try {
            OutputStream out = socket.getOutputStream();
            out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void disconnectClient() throws IOException {
        Socket socket = client;
        if (socket != null) {
            socket.close();
        }
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            try (Socket socket = serverSocket.accept()) {
                client = socket;
                serve(socket);
            } catch (IOException e) {
                // connection closed
            }
        }
    }

    private void serve(Socket socket) throws IOException {
        var reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        String handshake = reader.readLine();
        if (handshake == null) {
            return;
        }
        handshakeCount.incrementAndGet();
        handshakes.add(handshake);
        send(handshakeResponse);
        String line;
        while ((line = reader.readLine()) != null) {
            received.add(line);
            history.add(line);
        }
    }

    @Override
    public void close() throws IOException {
        serverSocket.close();
        disconnectClient();
    }
}
