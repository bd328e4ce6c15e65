// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.rpc;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC 2.0 request addressed to the receipt API.
 *
 * @param jsonrpc the protocol version, {@code "2.0"}
 * @param method  the method name
 * @param params  positional parameters
 * @param id      the request id, a string or number echoed unchanged in the response
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcRequest(String jsonrpc, String method, @Nullable List<?> params, @Nullable Object id) {

    public JsonRpcRequest {
        params = params == null ? List.of() : params;
    }
}
