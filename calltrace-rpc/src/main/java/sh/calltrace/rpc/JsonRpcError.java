// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcError(int code, String message, @JsonInclude(JsonInclude.Include.NON_NULL) Object data) {}
