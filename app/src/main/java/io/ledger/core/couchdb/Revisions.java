package io.ledger.core.couchdb;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/** CouchDB-style revision ids ({@code <generation>-<digest>}) for the embedded stores. */
final class Revisions {
    private Revisions() {}

    static String next(String currentRev, byte[] jsonBody, List<Attachment> attachments) {
        long generation = 1;
        if (currentRev != null) {
            int dash = currentRev.indexOf('-');
            generation = Long.parseLong(dash < 0 ? currentRev : currentRev.substring(0, dash)) + 1;
        }
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            if (currentRev != null) {
                md5.update(currentRev.getBytes(StandardCharsets.UTF_8));
            }
            if (jsonBody != null) {
                md5.update(jsonBody);
            }
            if (attachments != null) {
                for (Attachment attachment : attachments) {
                    md5.update(attachment.name().getBytes(StandardCharsets.UTF_8));
                    md5.update(attachment.data());
                }
            }
            return generation + "-" + HexFormat.of().formatHex(md5.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
