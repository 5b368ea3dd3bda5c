package com.leadhunter.api;

import com.leadhunter.search.model.LeadSearchResult;

public record LeadSearchResponse(String outputFile, LeadSearchResult result) {}
