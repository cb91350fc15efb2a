package br.com.tempmail.api.dto;

public record BatchDownload(
        String filename,
        String content
) {}
