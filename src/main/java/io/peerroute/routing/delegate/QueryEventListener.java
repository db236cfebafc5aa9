package io.peerroute.routing.delegate;

/**
 * Receives the decoded events of one delegate response, on the channel's event loop.
 */
interface QueryEventListener {

    /**
     * @return false to stop reading; the connection is then closed
     * @throws Exception to fail the response (e.g. an event carrying an invalid peer id)
     */
    boolean onEvent(QueryEvent event) throws Exception;

    /** The response body ended normally. */
    void onEnd();

    void onError(Throwable cause);

    /** True while the consumer wants more events; gates further reads. */
    boolean demanding();
}
