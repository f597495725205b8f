package com.cloudimages.storage;

import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * File-transfer backend over SFTP.
 *
 * Config: {@code remote_path}, optional {@code strict_host_key_checking}.
 * Credentials: {@code host}, {@code username}, and either {@code password} or
 * {@code private_key} (PEM text, optional {@code passphrase}); optional
 * {@code port} (default 22).
 *
 * The session is opened on first use and closed with the backend. Missing
 * remote directories are created on upload.
 */
public class SftpStorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(SftpStorageBackend.class);
    private static final int CONNECT_TIMEOUT_MS = 15_000;

    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final String privateKey;
    private final String passphrase;
    private final String remotePath;
    private final boolean strictHostKeyChecking;

    private Session session;
    private ChannelSftp channel;

    public SftpStorageBackend(Map<String, Object> config, Map<String, Object> credentials) {
        this.remotePath = normalizeRoot(BackendParams.required(config, "remote_path", "config"));
        this.strictHostKeyChecking = BackendParams.optionalBoolean(config, "strict_host_key_checking", false);
        this.host = BackendParams.required(credentials, "host", "credentials");
        this.username = BackendParams.required(credentials, "username", "credentials");
        this.port = BackendParams.optionalInt(credentials, "port", 22);
        this.password = BackendParams.optional(credentials, "password", null);
        this.privateKey = BackendParams.optional(credentials, "private_key", null);
        this.passphrase = BackendParams.optional(credentials, "passphrase", null);
    }

    @Override
    public String upload(byte[] data, String path, String contentType) throws JSchException, SftpException {
        ChannelSftp sftp = connect();
        String target = resolve(path);
        mkdirs(sftp, parentOf(target));
        sftp.put(new ByteArrayInputStream(data), target, ChannelSftp.OVERWRITE);
        log.debug("Uploaded {} bytes to sftp://{}{}", data.length, host, target);
        return path;
    }

    @Override
    public byte[] download(String path) throws JSchException, SftpException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        connect().get(resolve(path), out);
        return out.toByteArray();
    }

    @Override
    public DeleteOutcome delete(String path) throws JSchException, SftpException {
        try {
            connect().rm(resolve(path));
            return DeleteOutcome.DELETED;
        } catch (SftpException e) {
            if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                return DeleteOutcome.NOT_FOUND;
            }
            throw e;
        }
    }

    @Override
    public boolean exists(String path) throws JSchException, SftpException {
        return statExists(connect(), resolve(path));
    }

    @Override
    public ConnectionTestResult testConnection() {
        try {
            ChannelSftp sftp = connect();
            if (!statExists(sftp, remotePath)) {
                return ConnectionTestResult.error("Connection failed: remote path '" + remotePath + "' does not exist");
            }
            return ConnectionTestResult.success("Connection successful");
        } catch (Exception e) {
            return ConnectionTestResult.error("Connection failed: " + e.getMessage());
        }
    }

    @Override
    public String publicUrl(String path) {
        String target = resolve(path);
        return "sftp://" + host + (target.startsWith("/") ? "" : "/") + target;
    }

    @Override
    public void close() {
        if (channel != null) {
            channel.disconnect();
        }
        if (session != null) {
            session.disconnect();
        }
    }

    private ChannelSftp connect() throws JSchException {
        if (channel != null && channel.isConnected()) {
            return channel;
        }
        JSch jsch = new JSch();
        if (privateKey != null) {
            jsch.addIdentity("cloudimages-" + username,
                    privateKey.getBytes(StandardCharsets.UTF_8),
                    null,
                    passphrase != null ? passphrase.getBytes(StandardCharsets.UTF_8) : null);
        }
        session = jsch.getSession(username, host, port);
        if (password != null) {
            session.setPassword(password);
        }
        session.setConfig("StrictHostKeyChecking", strictHostKeyChecking ? "yes" : "no");
        session.connect(CONNECT_TIMEOUT_MS);

        channel = (ChannelSftp) session.openChannel("sftp");
        channel.connect(CONNECT_TIMEOUT_MS);
        return channel;
    }

    /**
     * Creates every missing directory from the root down to {@code directory}.
     */
    private void mkdirs(ChannelSftp sftp, String directory) throws SftpException {
        if (directory == null || directory.isEmpty() || directory.equals("/")) {
            return;
        }
        boolean absolute = directory.startsWith("/");
        StringBuilder current = new StringBuilder();
        for (String segment : directory.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            if (absolute || current.length() > 0) {
                current.append('/');
            }
            current.append(segment);
            String dir = current.toString();
            if (statExists(sftp, dir)) {
                continue;
            }
            try {
                sftp.mkdir(dir);
            } catch (SftpException e) {
                // A concurrent upload may have created it in the meantime.
                if (!statExists(sftp, dir)) {
                    throw e;
                }
            }
        }
    }

    private static boolean statExists(ChannelSftp sftp, String target) throws SftpException {
        try {
            sftp.stat(target);
            return true;
        } catch (SftpException e) {
            if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                return false;
            }
            throw e;
        }
    }

    String resolve(String path) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        return remotePath.equals("/") ? "/" + relative : remotePath + "/" + relative;
    }

    private static String parentOf(String target) {
        int slash = target.lastIndexOf('/');
        if (slash < 0) {
            return "";
        }
        return slash == 0 ? "/" : target.substring(0, slash);
    }

    /**
     * Strips trailing slashes. Relative roots stay relative to the login directory.
     */
    private static String normalizeRoot(String root) {
        String normalized = root;
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
