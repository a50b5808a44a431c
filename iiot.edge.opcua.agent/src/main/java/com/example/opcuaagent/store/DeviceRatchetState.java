package com.example.opcuaagent.store;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything persisted for one device: its current outbound session, if any, and the
 * inbound chains it can decrypt.
 */
public class DeviceRatchetState {

    private String deviceId;
    private OutboundSessionState outbound;
    private List<InboundChainState> inbound = new ArrayList<>();

    public DeviceRatchetState() {
    }

    public DeviceRatchetState(String deviceId) {
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public void setDeviceId(String deviceId) {
        this.deviceId = deviceId;
    }

    public OutboundSessionState getOutbound() {
        return outbound;
    }

    public void setOutbound(OutboundSessionState outbound) {
        this.outbound = outbound;
    }

    public List<InboundChainState> getInbound() {
        return inbound;
    }

    public void setInbound(List<InboundChainState> inbound) {
        this.inbound = inbound == null ? new ArrayList<>() : inbound;
    }

    InboundChainState findInbound(String sessionId) {
        for (InboundChainState chain : inbound) {
            if (chain.getSessionId().equals(sessionId)) {
                return chain;
            }
        }
        return null;
    }
}
