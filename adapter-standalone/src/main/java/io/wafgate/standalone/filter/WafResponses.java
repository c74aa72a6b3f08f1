package io.wafgate.standalone.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;

/**
 * Writes the JSON bodies the filter answers with itself:
 * <pre>{@code
 * {"code": 0, "msg": "Request blocked by Web Application Firewall"}
 * }</pre>
 *
 * <p>
 * Messages are fixed strings chosen by the gateway; engine output and stack
 * traces never reach the client. Thread-safe, all methods are stateless.
 */
public final class WafResponses {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String CONTENT_TYPE = "application/json";

    public static final String INITIALIZATION_FAILED = "WAF initialization failed";
    public static final String NOT_INITIALIZED = "WAF instance not initialized";
    public static final String CONVERSION_FAILED = "Failed to convert request";
    public static final String PROCESSING_FAILED = "WAF request processing failed";

    private WafResponses() {
        // utility class
    }

    /** The {@code {"code":0,"msg":...}} body. */
    public static ObjectNode body(String message) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("code", 0);
        node.put("msg", message);
        return node;
    }

    /** Sets status and content type, then writes the body for {@code message}. */
    public static void write(HttpServletResponse response, int status, String message) throws IOException {
        response.setStatus(status);
        response.setContentType(CONTENT_TYPE);
        response.setCharacterEncoding("UTF-8");
        PrintWriter writer = response.getWriter();
        writer.write(MAPPER.writeValueAsString(body(message)));
        writer.flush();
    }

    /** 500 with one of the fixed diagnostics. */
    public static void serverError(HttpServletResponse response, String message) throws IOException {
        write(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, message);
    }
}
