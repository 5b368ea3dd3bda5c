package com.leadhunter.search.http;

public interface PageFetcher {
    String fetch(String url, FetchOptions options) throws FetchException, InterruptedException;
}
