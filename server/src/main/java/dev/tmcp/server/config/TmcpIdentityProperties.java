package dev.tmcp.server.config;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import dev.tmcp.identity.IdentityFormat;
import dev.tmcp.identity.MismatchPolicy;
import dev.tmcp.identity.TmcpSettings;

/**
 * Configuration of the server's identity and of the directory it publishes to. Unset values fall
 * back to {@link TmcpSettings#defaults()}.
 */
@ConfigurationProperties(prefix = "tmcp.identity")
public class TmcpIdentityProperties {

	/**
	 * Server name; the wallet alias is derived from it and the active transport.
	 */
	private String name = "Tmcp";

	/**
	 * Directory holding the identity wallet.
	 */
	private String storeDir;

	/**
	 * Keep identities in memory only; a new identity is created on every start.
	 */
	private boolean inMemoryStore;

	private String publishUrl = TmcpSettings.DEFAULT_PUBLISH_URL;

	private String publishHistoryUrl = TmcpSettings.DEFAULT_PUBLISH_HISTORY_URL;

	/**
	 * Resolve URL template with a {@code {did}} placeholder. When unset, documents are fetched from
	 * the location encoded in the DID.
	 */
	private String resolveUrl;

	private String didFormat = TmcpSettings.DEFAULT_DID_FORMAT;

	/**
	 * Transport URL published for the server, e.g. {@code sse://localhost:8080/sse}.
	 */
	private String transport = "sse://localhost:8080/sse";

	private IdentityFormat identityFormat = IdentityFormat.WEBVH;

	private int maxNameLength = TmcpSettings.DEFAULT_MAX_NAME_LENGTH;

	private MismatchPolicy mismatchPolicy = MismatchPolicy.WARN;

	/**
	 * Log every sealed and opened envelope.
	 */
	private boolean verbose;

	public String getName() {
		return this.name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getStoreDir() {
		return this.storeDir;
	}

	public void setStoreDir(String storeDir) {
		this.storeDir = storeDir;
	}

	public boolean isInMemoryStore() {
		return this.inMemoryStore;
	}

	public void setInMemoryStore(boolean inMemoryStore) {
		this.inMemoryStore = inMemoryStore;
	}

	public String getPublishUrl() {
		return this.publishUrl;
	}

	public void setPublishUrl(String publishUrl) {
		this.publishUrl = publishUrl;
	}

	public String getPublishHistoryUrl() {
		return this.publishHistoryUrl;
	}

	public void setPublishHistoryUrl(String publishHistoryUrl) {
		this.publishHistoryUrl = publishHistoryUrl;
	}

	public String getResolveUrl() {
		return this.resolveUrl;
	}

	public void setResolveUrl(String resolveUrl) {
		this.resolveUrl = resolveUrl;
	}

	public String getDidFormat() {
		return this.didFormat;
	}

	public void setDidFormat(String didFormat) {
		this.didFormat = didFormat;
	}

	public String getTransport() {
		return this.transport;
	}

	public void setTransport(String transport) {
		this.transport = transport;
	}

	public IdentityFormat getIdentityFormat() {
		return this.identityFormat;
	}

	public void setIdentityFormat(IdentityFormat identityFormat) {
		this.identityFormat = identityFormat;
	}

	public int getMaxNameLength() {
		return this.maxNameLength;
	}

	public void setMaxNameLength(int maxNameLength) {
		this.maxNameLength = maxNameLength;
	}

	public MismatchPolicy getMismatchPolicy() {
		return this.mismatchPolicy;
	}

	public void setMismatchPolicy(MismatchPolicy mismatchPolicy) {
		this.mismatchPolicy = mismatchPolicy;
	}

	public boolean isVerbose() {
		return this.verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

	/**
	 * Resolve the wallet directory, preferring the configured property, then the
	 * {@code TMCP_STORE_DIR} environment variable, and finally {@code ~/.tmcp}.
	 * @return the normalized wallet directory
	 */
	public Path determineStoreDir() {
		if (StringUtils.hasText(this.storeDir)) {
			return normalize(Paths.get(this.storeDir));
		}
		String environmentOverride = System.getenv("TMCP_STORE_DIR");
		if (StringUtils.hasText(environmentOverride)) {
			return normalize(Paths.get(environmentOverride));
		}
		return normalize(Paths.get(System.getProperty("user.home"), ".tmcp"));
	}

	public TmcpSettings toSettings() {
		return TmcpSettings.builder()
			.didPublishUrl(this.publishUrl)
			.didPublishHistoryUrl(this.publishHistoryUrl)
			.didResolveUrl(StringUtils.hasText(this.resolveUrl) ? this.resolveUrl : null)
			.didFormat(this.didFormat)
			.transport(this.transport)
			.identityFormat(this.identityFormat)
			.maxNameLength(this.maxNameLength)
			.mismatchPolicy(this.mismatchPolicy)
			.verbose(this.verbose)
			.build();
	}

	private static Path normalize(Path candidate) {
		return candidate.toAbsolutePath().normalize();
	}

}
