package com.health.misinfo.model;

/** Number of matching posts that share the same content. */
public record TopicCount(String content, int posts) {}
