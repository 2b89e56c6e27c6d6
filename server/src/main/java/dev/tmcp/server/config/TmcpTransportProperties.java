package dev.tmcp.server.config;

import java.time.Duration;
import java.util.Objects;

import org.springframework.boot.context.properties.ConfigurationProperties;

import dev.tmcp.server.session.ReconnectPolicy;

/**
 * Configuration properties of the secure transport layer: which transport is exposed, on which
 * paths, and how connections behave.
 */
@ConfigurationProperties(prefix = "tmcp.transport")
public class TmcpTransportProperties {

	/**
	 * Transport technology used to expose the server. Defaults to SSE.
	 */
	private TransportType type = TransportType.SSE;

	/**
	 * Path of the SSE stream.
	 */
	private String ssePath = "/sse";

	/**
	 * Path clients POST their messages to; announced in the endpoint event.
	 */
	private String messagePath = "/messages/";

	/**
	 * Path of the WebSocket endpoint.
	 */
	private String webSocketPath = "/ws";

	/**
	 * Servlet async timeout of an SSE stream. Zero keeps the stream open until either side closes it.
	 */
	private Duration sseTimeout = Duration.ZERO;

	/**
	 * Idle time after which a comment frame is written to an SSE stream, so dropped clients are
	 * noticed without waiting for the next message.
	 */
	private Duration keepAliveInterval = Duration.ofSeconds(15);

	/**
	 * How sealed envelopes are carried in WebSocket frames.
	 */
	private FrameFormat frameFormat = FrameFormat.TEXT;

	/**
	 * What happens when a peer opens a second SSE stream while one is live.
	 */
	private ReconnectPolicy reconnectPolicy = ReconnectPolicy.REPLACE;

	public TransportType getType() {
		return this.type;
	}

	public void setType(TransportType type) {
		this.type = Objects.requireNonNullElse(type, TransportType.SSE);
	}

	public String getSsePath() {
		return this.ssePath;
	}

	public void setSsePath(String ssePath) {
		this.ssePath = ssePath;
	}

	public String getMessagePath() {
		return this.messagePath;
	}

	public void setMessagePath(String messagePath) {
		this.messagePath = messagePath;
	}

	public String getWebSocketPath() {
		return this.webSocketPath;
	}

	public void setWebSocketPath(String webSocketPath) {
		this.webSocketPath = webSocketPath;
	}

	public Duration getSseTimeout() {
		return this.sseTimeout;
	}

	public void setSseTimeout(Duration sseTimeout) {
		this.sseTimeout = Objects.requireNonNullElse(sseTimeout, Duration.ZERO);
	}

	public Duration getKeepAliveInterval() {
		return this.keepAliveInterval;
	}

	public void setKeepAliveInterval(Duration keepAliveInterval) {
		this.keepAliveInterval = Objects.requireNonNullElse(keepAliveInterval, Duration.ofSeconds(15));
	}

	public FrameFormat getFrameFormat() {
		return this.frameFormat;
	}

	public void setFrameFormat(FrameFormat frameFormat) {
		this.frameFormat = Objects.requireNonNullElse(frameFormat, FrameFormat.TEXT);
	}

	public ReconnectPolicy getReconnectPolicy() {
		return this.reconnectPolicy;
	}

	public void setReconnectPolicy(ReconnectPolicy reconnectPolicy) {
		this.reconnectPolicy = Objects.requireNonNullElse(reconnectPolicy, ReconnectPolicy.REPLACE);
	}

	/**
	 * Available transport implementations.
	 */
	public enum TransportType {
		SSE, WEBSOCKET
	}

	/**
	 * WebSocket frame encodings. Both are accepted on receive.
	 */
	public enum FrameFormat {
		/** URL-safe base64 text frames. */
		TEXT,
		/** Raw envelope bytes in binary frames. */
		BINARY
	}

}
