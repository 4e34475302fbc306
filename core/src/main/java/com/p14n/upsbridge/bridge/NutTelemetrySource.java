package com.p14n.upsbridge.bridge;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads UPS variables from a NUT daemon over its line-based TCP protocol.
 *
 * <pre>
 * C: LIST VAR myups
 * S: BEGIN LIST VAR myups
 * S: VAR myups battery.charge "100"
 * S: END LIST VAR myups
 * </pre>
 */
public class NutTelemetrySource implements TelemetrySource {

    private static final Logger logger = LoggerFactory.getLogger(NutTelemetrySource.class);

    public static final int DEFAULT_PORT = 3493;

    private final String host;
    private final int port;
    private final String upsName;
    private final Duration connectTimeout;
    private final Duration readTimeout;

    private final Object lock = new Object();
    private Socket socket;
    private BufferedReader reader;
    private Writer writer;
    private volatile boolean connected;

    public NutTelemetrySource(String host, int port, String upsName) {
        this(host, port, upsName, Duration.ofSeconds(5), Duration.ofSeconds(10));
    }

    /**
     * @param upsName UPS name, an {@code @host} suffix is ignored
     */
    public NutTelemetrySource(String host, int port, String upsName, Duration connectTimeout, Duration readTimeout) {
        this.host = host;
        this.port = port;
        this.upsName = stripHost(upsName);
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
    }

    static String stripHost(String upsName) {
        int at = upsName.indexOf('@');
        return at < 0 ? upsName : upsName.substring(0, at);
    }

    @Override
    public boolean connect() {
        synchronized (lock) {
            if (connected) {
                return true;
            }
            Socket s = new Socket();
            try {
                s.connect(new InetSocketAddress(host, port), (int) connectTimeout.toMillis());
                s.setSoTimeout((int) readTimeout.toMillis());
                reader = new BufferedReader(new InputStreamReader(s.getInputStream(), StandardCharsets.UTF_8));
                writer = new OutputStreamWriter(s.getOutputStream(), StandardCharsets.UTF_8);
                socket = s;
                connected = true;
            } catch (IOException e) {
                logger.atWarn().log("Unable to connect to NUT at {}:{}: {}", host, port, e.getMessage());
                closeQuietly(s);
                return false;
            }
        }
        logger.atInfo().log("Connected to NUT at {}:{} (ups {})", host, port, upsName);
        return true;
    }

    @Override
    public void disconnect() {
        synchronized (lock) {
            if (!connected) {
                return;
            }
            try {
                writer.write("LOGOUT\n");
                writer.flush();
            } catch (IOException e) {
                logger.atDebug().log("LOGOUT failed: {}", e.getMessage());
            }
            drop();
        }
        logger.atInfo().log("Disconnected from NUT at {}:{}", host, port);
    }

    // caller holds lock
    private void drop() {
        closeQuietly(socket);
        socket = null;
        reader = null;
        writer = null;
        connected = false;
    }

    private void closeQuietly(Socket s) {
        if (s == null) {
            return;
        }
        try {
            s.close();
        } catch (IOException e) {
            logger.atDebug().log("Socket close failed: {}", e.getMessage());
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public Map<String, String> fetchAll() {
        Map<String, String> vars = new LinkedHashMap<>();
        synchronized (lock) {
            if (!connected) {
                logger.atWarn().log("NUT fetch requested while disconnected");
                return vars;
            }
            try {
                writer.write("LIST VAR " + upsName + "\n");
                writer.flush();
                String line = reader.readLine();
                if (line == null) {
                    throw new IOException("Connection closed by server");
                }
                if (line.startsWith("ERR")) {
                    logger.atWarn().log("NUT rejected LIST VAR {}: {}", upsName, line);
                    return vars;
                }
                if (!line.startsWith("BEGIN LIST VAR")) {
                    throw new IOException("Unexpected reply: " + line);
                }
                String prefix = "VAR " + upsName + " ";
                while ((line = reader.readLine()) != null) {
                    if (line.startsWith("END LIST VAR")) {
                        return vars;
                    }
                    if (line.startsWith(prefix)) {
                        parseVar(line.substring(prefix.length()), vars);
                    }
                }
                throw new IOException("Connection closed during LIST VAR");
            } catch (IOException e) {
                logger.atWarn().log("NUT fetch failed, dropping connection: {}", e.getMessage());
                drop();
                return new LinkedHashMap<>();
            }
        }
    }

    /**
     * Parses {@code name "value"}, unescaping {@code \"} and {@code \\}.
     */
    static void parseVar(String rest, Map<String, String> into) {
        int space = rest.indexOf(' ');
        if (space <= 0) {
            return;
        }
        String name = rest.substring(0, space);
        String quoted = rest.substring(space + 1).trim();
        if (quoted.length() < 2 || quoted.charAt(0) != '"' || quoted.charAt(quoted.length() - 1) != '"') {
            return;
        }
        StringBuilder value = new StringBuilder();
        for (int i = 1; i < quoted.length() - 1; i++) {
            char c = quoted.charAt(i);
            if (c == '\\' && i + 1 < quoted.length() - 1) {
                c = quoted.charAt(++i);
            }
            value.append(c);
        }
        String v = value.toString().trim();
        if (!v.isEmpty()) {
            into.put(name, v);
        }
    }
}
