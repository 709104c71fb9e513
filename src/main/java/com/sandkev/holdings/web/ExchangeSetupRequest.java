package com.sandkev.holdings.web;

public record ExchangeSetupRequest(String apiKey, String apiSecret) {}
