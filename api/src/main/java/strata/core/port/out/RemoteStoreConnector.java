package strata.core.port.out;

/**
 * Opens remote store connections. Called for the initial connect and for every reconnect attempt.
 */
@FunctionalInterface
public interface RemoteStoreConnector {

    /**
     * @throws strata.spi.RemoteTierException if no connection can be established
     */
    RemoteStore connect();
}
