package org.example.cryoingest.transfer;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies files with an rsync subprocess reading the file list from stdin. The
 * destination is an rsync daemon module, {@code host::module/path/}, or a plain
 * path for local rsync.
 */
@Slf4j
public class RsyncCopier implements FileCopier {

    private final String remote;

    public RsyncCopier(String remote) {
        this.remote = remote;
    }

    /**
     * Destination on the rsync daemon of the control-plane host.
     */
    public static RsyncCopier forDaemon(String host, String module, String remotePath) {
        return new RsyncCopier(host + "::" + module + "/" + remotePath + "/");
    }

    @Override
    public String destination() {
        return remote;
    }

    List<String> command(boolean removeSource) {
        List<String> cmd = new ArrayList<>(List.of(
                "rsync",
                "-iiv",
                "--times",
                "--progress",
                "--outbuf=line",
                "--files-from=-",
                "-p",
                "--chmod=D0750,F0750"));
        if (removeSource) {
            cmd.add("--remove-source-files");
        }
        cmd.add(".");
        cmd.add(remote);
        return cmd;
    }

    @Override
    public CopyResult copy(Path basepath, List<Path> relativeFiles, boolean removeSource)
            throws IOException, InterruptedException {
        if (relativeFiles.isEmpty()) return CopyResult.empty();

        ProcessBuilder pb = new ProcessBuilder(command(removeSource));
        pb.directory(basepath.toFile());
        Path stderr = Files.createTempFile("rsync", ".err");
        pb.redirectError(stderr.toFile());
        try {
            Process process = pb.start();
            try (OutputStream stdin = process.getOutputStream()) {
                for (Path f : relativeFiles) {
                    stdin.write(f.toString().getBytes(StandardCharsets.UTF_8));
                    stdin.write('\n');
                }
            }
            String stdout = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            int exit = process.waitFor();

            for (String line : Files.readAllLines(stderr, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) log.warn("rsync stderr: {}", line);
            }
            RsyncOutputParser parser = new RsyncOutputParser();
            parser.parse(stdout);
            if (exit != 0) {
                log.warn("rsync process finished with return code {}", exit);
            } else {
                log.debug("rsync process finished with return code 0");
            }
            return new CopyResult(parser.getConfirmed(), exit == 0);
        } finally {
            Files.deleteIfExists(stderr);
        }
    }
}
