package org.anarplex.lib.firewall.env;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

public interface NetworkUtilities {

    /**
     * The communication pathway between one connected client and the firewall ProtocolEngine.
     */
    interface ProtocolStreams {
        InputStream getInputStream();
        OutputStream getOutputStream();

        /**
         * @return a printable form of the client's address, for logging
         */
        String getRemoteAddress();

        void closeConnection();
    }

    /**
     * Opens a port (specified by the supplied properties) for listening for incoming connections and dispatches such
     * new connections to the supplied ConnectionListener.  Returns a ServiceManager that can be used to start and
     * terminate the Service.
     */
    ServiceManager registerService(ConnectionListener cl);

    interface ConnectionListener {
        /**
         * Invoked on a worker thread of its own for every newly accepted connection.  The connection is closed once
         * this method returns.
         * Will not be invoked until start() is called on the ServiceManager.
         */
        void onConnection(ProtocolStreams newConnection);
    }

    interface ServiceManager {
        /**
         * Binds the listening port and starts accepting connections in the background.
         *
         * @throws IOException if the port cannot be bound
         */
        void start() throws IOException;

        /**
         * @return the port actually listened on, once started
         */
        int getLocalPort();

        /**
         * Blocks until the service has been terminated.
         */
        void awaitTermination() throws InterruptedException;

        void terminate();
    }
}
