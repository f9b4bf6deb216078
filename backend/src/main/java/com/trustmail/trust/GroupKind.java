package com.trustmail.trust;

public enum GroupKind {
    NAME,
    ID
}
