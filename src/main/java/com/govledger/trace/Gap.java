package com.govledger.trace;

public record Gap(TraceDomain domain, String expectedRef, String detail) {
}
