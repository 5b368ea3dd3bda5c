package com.leadhunter.search.service;

public enum RunState {
    NEW,
    EXPANDING,
    DISPATCHING,
    MERGING,
    DONE
}
