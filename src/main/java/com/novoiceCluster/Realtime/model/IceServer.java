package com.novoiceCluster.Realtime.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.List;

/**
 * One entry of an {@code RTCConfiguration.iceServers} list.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IceServer {
    List<String> urls;
    String username;
    String credential;

    public static IceServer stun(List<String> urls) {
        return new IceServer(urls, null, null);
    }
}
