package org.anarplex.lib.firewall.env;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * TCP implementation of NetworkUtilities.  Every accepted connection is handed to the ConnectionListener on a worker
 * thread of its own, with the configured receive timeout applied to its socket.
 */
public class SocketNetworkUtilities implements NetworkUtilities {
    private static final Logger logger = LoggerFactory.getLogger(SocketNetworkUtilities.class);

    private final ServerProperties properties;

    public SocketNetworkUtilities(ServerProperties properties) {
        if (properties == null) {
            throw new NullPointerException("properties must not be null");
        }
        this.properties = properties;
    }

    @Override
    public NetworkUtilities.ServiceManager registerService(ConnectionListener cl) {
        if (cl == null) {
            throw new NullPointerException("ConnectionListener must not be null");
        }
        return new ServiceManager(cl, properties);
    }


    private static class ServiceManager implements NetworkUtilities.ServiceManager, Runnable {
        private final ConnectionListener listener;
        private final ServerProperties properties;
        private final ExecutorService executorService = Executors.newCachedThreadPool();
        private final CountDownLatch terminated = new CountDownLatch(1);
        private volatile ServerSocket serverSocket;

        ServiceManager(ConnectionListener listener, ServerProperties properties) {
            this.listener = listener;
            this.properties = properties;
        }

        @Override
        public void start() throws IOException {
            if (serverSocket != null) {
                throw new IllegalStateException("service already started");
            }
            ServerSocket socket = new ServerSocket();
            try {
                socket.setReuseAddress(true);
                socket.bind(new InetSocketAddress(properties.getPort()), properties.getListenBacklog());
            } catch (IOException e) {
                logger.error("Unable to listen on port {}: {}", properties.getPort(), e.getMessage());
                socket.close();
                throw e;
            }
            serverSocket = socket;
            logger.info("Server started, listening on port {}", socket.getLocalPort());

            Thread thread = new Thread(this, "firewall-accept-" + socket.getLocalPort());
            thread.start();
        }

        @Override
        public int getLocalPort() {
            ServerSocket socket = serverSocket;
            return socket == null ? -1 : socket.getLocalPort();
        }

        @Override
        public void run() {
            try {
                while (!serverSocket.isClosed()) {
                    Socket clientSocket = serverSocket.accept();
                    logger.info("Accepted connection from {}", clientSocket.getRemoteSocketAddress());
                    clientSocket.setSoTimeout(properties.getReceiveTimeoutMillis());

                    // handle the client on a worker thread of its own
                    executorService.execute(new ClientHandler(clientSocket, listener));
                }
            } catch (SocketException e) {
                if (!serverSocket.isClosed()) {
                    logger.error("Server error: {}", e.getMessage(), e);
                }
            } catch (IOException e) {
                logger.error("Server error: {}", e.getMessage(), e);
            } finally {
                executorService.shutdown();
                terminated.countDown();
            }
        }

        @Override
        public void awaitTermination() throws InterruptedException {
            terminated.await();
        }

        @Override
        public void terminate() {
            ServerSocket socket = serverSocket;
            if (socket != null) {
                try {
                    socket.close();
                } catch (IOException e) {
                    logger.warn("Error closing server socket: {}", e.getMessage());
                }
            } else {
                terminated.countDown();
            }
            executorService.shutdown();
        }
    }


    // handles one accepted connection
    private static class ClientHandler implements Runnable {
        private final Socket clientSocket;
        private final ConnectionListener listener;

        ClientHandler(Socket clientSocket, ConnectionListener listener) {
            this.clientSocket = clientSocket;
            this.listener = listener;
        }

        @Override
        public void run() {
            try {
                listener.onConnection(new SocketProtocolStreams(clientSocket));
            } catch (RuntimeException e) {
                logger.error("Error handling connection from {}: {}", clientSocket.getRemoteSocketAddress(), e.getMessage(), e);
            } finally {
                close(clientSocket);
            }
        }
    }

    private static class SocketProtocolStreams implements ProtocolStreams {
        private final Socket socket;

        SocketProtocolStreams(Socket socket) {
            this.socket = socket;
        }

        @Override
        public InputStream getInputStream() {
            try {
                return socket.getInputStream();
            } catch (IOException e) {
                throw new RuntimeException(e);
            }
        }

        @Override
        public OutputStream getOutputStream() {
            try {
                return socket.getOutputStream();
            } catch (IOException e) {
                throw new RuntimeException(e);
            }
        }

        @Override
        public String getRemoteAddress() {
            return String.valueOf(socket.getRemoteSocketAddress());
        }

        @Override
        public void closeConnection() {
            close(socket);
        }
    }

    private static void close(Socket socket) {
        if (!socket.isClosed()) {
            logger.info("Closing connection from {}", socket.getRemoteSocketAddress());
            try {
                socket.close();
            } catch (IOException e) {
                logger.error("Error closing client connection: {}", e.getMessage());
            }
        }
    }
}
