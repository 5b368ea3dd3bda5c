package com.leadhunter.search.parse;

import com.leadhunter.search.model.RawHit;

import java.util.List;

public record ParseResult(List<RawHit> hits, boolean containerFound, int skipped) {
    public ParseResult {
        hits = List.copyOf(hits);
    }
}
