package dev.tmcp.server.config;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.tmcp.channel.SecureChannelProvider;
import dev.tmcp.channel.WalletSecureChannelProvider;
import dev.tmcp.directory.DirectoryClient;
import dev.tmcp.directory.HttpDirectoryClient;
import dev.tmcp.identity.FileIdentityStore;
import dev.tmcp.identity.IdentityManager;
import dev.tmcp.identity.IdentityStore;
import dev.tmcp.identity.InMemoryIdentityStore;
import dev.tmcp.server.handler.DuplexSessionHandler;
import dev.tmcp.server.handler.PingSessionHandler;
import dev.tmcp.server.security.TransportSecurityValidator;
import dev.tmcp.transport.JsonRpcCodec;

/**
 * Spring configuration assembling the server identity, the secure channel provider and the shared
 * pieces both transports use.
 */
@Configuration
@EnableConfigurationProperties({ TmcpIdentityProperties.class, TmcpTransportProperties.class,
		TransportSecurityProperties.class })
public class TmcpServerConfig {

	private static final Logger logger = LoggerFactory.getLogger(TmcpServerConfig.class);

	private static final Duration DIRECTORY_TIMEOUT = Duration.ofSeconds(10);

	@Bean
	public DirectoryClient directoryClient(TmcpIdentityProperties identityProperties) {
		return HttpDirectoryClient.create(identityProperties.toSettings(), DIRECTORY_TIMEOUT);
	}

	@Bean
	public IdentityStore identityStore(TmcpIdentityProperties identityProperties) {
		if (identityProperties.isInMemoryStore()) {
			logger.info("Using in-memory identity store");
			return new InMemoryIdentityStore();
		}
		logger.info("Using identity store in {}", identityProperties.determineStoreDir());
		return new FileIdentityStore(identityProperties.determineStoreDir());
	}

	@Bean
	public SecureChannelProvider secureChannelProvider(IdentityStore identityStore, DirectoryClient directoryClient,
			ObjectMapper objectMapper) {
		return new WalletSecureChannelProvider(identityStore, directoryClient, objectMapper);
	}

	/**
	 * Initialise the server identity, creating and publishing a new one when the stored identity is
	 * missing or no longer resolves.
	 * @return the initialised identity manager
	 */
	@Bean
	public IdentityManager identityManager(SecureChannelProvider secureChannelProvider,
			TmcpIdentityProperties identityProperties, TmcpTransportProperties transportProperties) {
		IdentityManager identityManager = new IdentityManager(secureChannelProvider, identityProperties.toSettings());
		String suffix = transportProperties.getType() == TmcpTransportProperties.TransportType.WEBSOCKET
				? "TmcpWsServer" : "TmcpSseServer";
		identityManager.init(identityProperties.getName() + suffix);
		logger.info("Server identity {} published with transport {}", identityManager.localDid(),
				identityProperties.getTransport());
		return identityManager;
	}

	@Bean
	public TransportSecurityValidator transportSecurityValidator(TransportSecurityProperties securityProperties) {
		return new TransportSecurityValidator(securityProperties);
	}

	@Bean
	public JsonRpcCodec jsonRpcCodec(ObjectMapper objectMapper) {
		return new JsonRpcCodec(objectMapper);
	}

	@Bean
	@ConditionalOnMissingBean(DuplexSessionHandler.class)
	public DuplexSessionHandler duplexSessionHandler() {
		return new PingSessionHandler();
	}

	@Bean(destroyMethod = "shutdownNow")
	public ExecutorService transportExecutor() {
		CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("tmcp-transport-");
		threadFactory.setDaemon(true);
		return Executors.newCachedThreadPool(threadFactory);
	}

}
