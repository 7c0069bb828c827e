package io.envvault.credentials;

/**
 * Source of the AppRole credential file, addressed by bucket and key.
 *
 * @see S3CredentialSource
 */
public interface CredentialSource {

    /**
     * Downloads a credential file.
     *
     * @param bucket the bucket name
     * @param key    the object key
     * @return the file content
     * @throws CredentialSourceException if the file cannot be downloaded
     */
    byte[] fetch(String bucket, String key) throws CredentialSourceException;
}
