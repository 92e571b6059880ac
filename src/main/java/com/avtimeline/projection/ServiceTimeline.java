package com.avtimeline.projection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** The states of one service in effective-date order, plus its lifecycle stage. */
public class ServiceTimeline {

    private final String serviceId;
    private final List<ServiceState> states = new ArrayList<>();
    private LifecycleStage stage = LifecycleStage.NONE;

    public ServiceTimeline(String serviceId) {
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }

    public LifecycleStage getStage() {
        return stage;
    }

    void setStage(LifecycleStage stage) {
        this.stage = stage;
    }

    public List<ServiceState> getStates() {
        return Collections.unmodifiableList(states);
    }

    void add(ServiceState state) {
        states.add(state);
    }

    /** Most recently created state, open or closed. */
    Optional<ServiceState> latest() {
        return states.isEmpty() ? Optional.empty() : Optional.of(states.get(states.size() - 1));
    }

    List<ServiceState> openStates() {
        return states.stream().filter(ServiceState::isOpen).toList();
    }

    /** The open state, scanning from the most recent end. */
    Optional<ServiceState> openState() {
        for (int i = states.size() - 1; i >= 0; i--) {
            if (states.get(i).isOpen()) {
                return Optional.of(states.get(i));
            }
        }
        return Optional.empty();
    }
}
