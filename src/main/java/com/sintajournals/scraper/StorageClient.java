package com.sintajournals.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link StorageClientInterface} writing local files with NIO and remote files through an
 * optional {@link WebHdfsClient}. Without a WebHDFS client every remote operation fails.
 */
public class StorageClient implements StorageClientInterface {
    private static final Logger logger = LoggerFactory.getLogger(StorageClient.class);

    private final WebHdfsClient hdfs;

    public StorageClient() {
        this(null);
    }

    public StorageClient(WebHdfsClient hdfs) {
        this.hdfs = hdfs;
    }

    @Override
    public boolean writeLocal(Path path, byte[] content) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.write(path, content);
            return true;
        } catch (IOException e) {
            logger.error("Failed to write {}: {}", path, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean ensureRemoteDir(String path) {
        if (hdfs == null) {
            logger.warn("ensureRemoteDir({}) called without an HDFS client", path);
            return false;
        }
        try {
            hdfs.mkdirs(path);
            return true;
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to create HDFS directory {}: {}", path, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean writeRemote(String path, byte[] content) {
        if (hdfs == null) {
            logger.warn("writeRemote({}) called without an HDFS client", path);
            return false;
        }
        try {
            hdfs.create(path, content);
            return true;
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to upload to HDFS {}: {}", path, e.getMessage());
            return false;
        }
    }
}
