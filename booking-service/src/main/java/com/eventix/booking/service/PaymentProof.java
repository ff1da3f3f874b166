package com.eventix.booking.service;

public record PaymentProof(byte[] content, String filename) {
}
