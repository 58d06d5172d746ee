package com.copyleft.Ordo.domain.vo;

public record TallyEntry(String option, int score) {
}
