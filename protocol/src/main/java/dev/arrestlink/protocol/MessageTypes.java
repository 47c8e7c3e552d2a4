package dev.arrestlink.protocol;

/**
 * Message type vocabulary shared by the arrest data client and server, plus the status values
 * carried in replies.
 */
public final class MessageTypes {

    public static final String REGISTER = "REGISTER";
    public static final String LOGIN = "LOGIN";
    public static final String LOGOUT = "LOGOUT";
    public static final String QUERY = "QUERY";
    public static final String QUERY_RESULT = "QUERY_RESULT";
    public static final String SERVER_MESSAGE = "SERVER_MESSAGE";
    public static final String CLIENT_LIST = "CLIENT_LIST";
    public static final String CLIENT_INFO = "CLIENT_INFO";
    public static final String CLIENT_HISTORY = "CLIENT_HISTORY";
    public static final String QUERY_STATS = "QUERY_STATS";
    public static final String GET_METADATA = "GET_METADATA";
    public static final String ERROR = "ERROR";
    public static final String PING = "PING";
    public static final String PONG = "PONG";

    public static final String STATUS_OK = "OK";
    public static final String STATUS_ERROR = "ERROR";

    private MessageTypes() {
    }
}
