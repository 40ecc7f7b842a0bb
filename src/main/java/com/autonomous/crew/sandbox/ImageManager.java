package com.autonomous.crew.sandbox;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Builds the agent sandbox image on demand. The tag carries a hash of the Dockerfile, so an edited
 * Dockerfile shows up as a missing image and gets rebuilt.
 */
@Slf4j
public class ImageManager {

    private final DockerClient docker;
    private final String imageName;
    private final String dockerfile;

    public ImageManager(DockerClient docker, String imageName, String dockerfile) {
        this.docker = docker;
        this.imageName = imageName;
        this.dockerfile = dockerfile;
    }

    public static String contentHash(String content) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String resolveTag() {
        return imageName + ":" + contentHash(dockerfile);
    }

    /** @return the tag of an image that exists after this call */
    public synchronized String ensureImage() {
        String tag = resolveTag();
        if (docker.imageExists(tag)) {
            return tag;
        }
        Path context = null;
        try {
            context = Files.createTempDirectory("crew-image-");
            Files.writeString(context.resolve("Dockerfile"), dockerfile);
            docker.buildImage(tag, context);
            log.info("Built sandbox image {}", tag);
            return tag;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to prepare build context for " + tag, e);
        } finally {
            if (context != null) {
                deleteBuildContext(context);
            }
        }
    }

    private static void deleteBuildContext(Path dir) {
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.warn("Could not remove build context {}: {}", dir, e.getMessage());
        }
    }
}
