package com.health.misinfo.model;

import java.time.LocalDate;

public record TimelinePoint(LocalDate date, int posts) {}
