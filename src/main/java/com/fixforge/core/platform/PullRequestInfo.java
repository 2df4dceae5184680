package com.fixforge.core.platform;

public record PullRequestInfo(int number, String url, String title) {}
