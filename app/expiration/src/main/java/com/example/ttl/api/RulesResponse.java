package com.example.ttl.api;

import java.util.List;

public record RulesResponse(List<RuleResponse> rules) {}
