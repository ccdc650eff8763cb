package app.kartoteka.exchange.service;

public record JobArtifact(
        String fileName,
        String contentType,
        byte[] content
) {
}
