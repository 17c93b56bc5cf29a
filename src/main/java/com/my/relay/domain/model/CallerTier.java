package com.my.relay.domain.model;

public enum CallerTier {
    STANDARD,
    PRIVILEGED
}
