/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.testbridge.transport;

import io.testbridge.common.Json;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One JSON frame on the reporter side channel.
 * Requests and notifications carry {@code id, method, params};
 * responses carry {@code id} plus {@code result} or {@code error}.
 */
public record ProtocolMessage(
        Integer id,
        String method,
        Map<String, Object> params,
        Object result,
        Map<String, Object> error
) {

    public static ProtocolMessage request(int id, String method, Map<String, Object> params) {
        return new ProtocolMessage(id, method, params != null ? params : Collections.emptyMap(), null, null);
    }

    public static ProtocolMessage notification(String method, Map<String, Object> params) {
        return request(0, method, params);
    }

    public static ProtocolMessage fromMap(Map<String, Object> map) {
        Integer id = map.get("id") instanceof Number n ? n.intValue() : null;
        return new ProtocolMessage(
                id,
                Json.getString(map, "method"),
                Json.getMap(map, "params"),
                map.get("result"),
                Json.getMap(map, "error")
        );
    }

    /**
     * Decode one frame.
     *
     * @throws TransportException of type MALFORMED_FRAME when the text is not a JSON object
     */
    public static ProtocolMessage parse(String json) {
        try {
            return fromMap(Json.parseObject(json));
        } catch (RuntimeException e) {
            throw new TransportException(TransportException.Type.MALFORMED_FRAME,
                    "malformed frame: " + e.getMessage(), e);
        }
    }

    public boolean hasMethod(String name) {
        return name.equals(method);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (id != null) {
            map.put("id", id);
        }
        if (method != null) {
            map.put("method", method);
        }
        if (params != null) {
            map.put("params", params);
        }
        if (result != null) {
            map.put("result", result);
        }
        if (error != null) {
            map.put("error", error);
        }
        return map;
    }

    public String toJson() {
        return Json.toJson(toMap());
    }

}
