package org.atomicswap.api;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.atomicswap.api.resource.AnnotationPostProcessor;
import org.atomicswap.api.resource.ApiDefinition;
import org.atomicswap.api.resource.HealthResource;
import org.atomicswap.api.resource.SwapResource;
import org.atomicswap.controller.swap.SwapCoordinator;
import org.atomicswap.settings.Settings;
import org.eclipse.jetty.rewrite.handler.RedirectPatternRule;
import org.eclipse.jetty.rewrite.handler.RewriteHandler;
import org.eclipse.jetty.server.CustomRequestLog;
import org.eclipse.jetty.server.RequestLog;
import org.eclipse.jetty.server.RequestLogWriter;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.ErrorHandler;
import org.eclipse.jetty.server.handler.InetAccessHandler;
import org.eclipse.jetty.servlet.FilterHolder;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.servlets.CrossOriginFilter;
import org.glassfish.jersey.server.ResourceConfig;
import org.glassfish.jersey.servlet.ServletContainer;

import io.swagger.v3.jaxrs2.integration.resources.OpenApiResource;

public class ApiService {

	private static final Logger LOGGER = LogManager.getLogger(ApiService.class);

	private static final List<Class<?>> RESOURCE_CLASSES = List.of(SwapResource.class, HealthResource.class);

	private final ResourceConfig config;
	private Server server;

	public ApiService(SwapCoordinator swapCoordinator) {
		this.config = new ResourceConfig();
		this.config.register(new SwapResource(swapCoordinator));
		this.config.register(HealthResource.class);
		this.config.register(OpenApiResource.class);
		this.config.register(ApiDefinition.class);
		this.config.register(AnnotationPostProcessor.class);
	}

	/** Resource classes whose {@link ApiErrors} are added to the OpenAPI document. */
	public static List<Class<?>> getResourceClasses() {
		return RESOURCE_CLASSES;
	}

	public void start() {
		try {
			// Create API server
			InetAddress bindAddr = InetAddress.getByName(Settings.getInstance().getBindAddress());
			InetSocketAddress endpoint = new InetSocketAddress(bindAddr, Settings.getInstance().getApiPort());
			this.server = new Server(endpoint);

			// Error handler
			ErrorHandler errorHandler = new ApiErrorHandler();
			this.server.setErrorHandler(errorHandler);

			// Request logging
			if (Settings.getInstance().isApiLoggingEnabled()) {
				RequestLogWriter logWriter = new RequestLogWriter("API-requests.log");
				logWriter.setAppend(true);
				logWriter.setTimeZone("UTC");
				RequestLog requestLog = new CustomRequestLog(logWriter, CustomRequestLog.EXTENDED_NCSA_FORMAT);
				this.server.setRequestLog(requestLog);
			}

			// IP address based access control
			InetAccessHandler accessHandler = new InetAccessHandler();
			for (String pattern : Settings.getInstance().getApiWhitelist()) {
				accessHandler.include(pattern);
			}
			this.server.setHandler(accessHandler);

			// URL rewriting
			RewriteHandler rewriteHandler = new RewriteHandler();
			accessHandler.setHandler(rewriteHandler);
			rewriteHandler.addRule(new RedirectPatternRule("", "/openapi.json")); // redirect empty path to API definition

			// Context
			ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
			context.setContextPath("/");
			rewriteHandler.setHandler(context);

			// Cross-origin resource sharing
			FilterHolder corsFilterHolder = new FilterHolder(CrossOriginFilter.class);
			corsFilterHolder.setInitParameter(CrossOriginFilter.ALLOWED_ORIGINS_PARAM, "*");
			corsFilterHolder.setInitParameter(CrossOriginFilter.ALLOWED_METHODS_PARAM, "GET, POST");
			corsFilterHolder.setInitParameter(CrossOriginFilter.CHAIN_PREFLIGHT_PARAM, "false");
			context.addFilter(corsFilterHolder, "/*", null);

			// API servlet
			ServletContainer container = new ServletContainer(this.config);
			ServletHolder apiServlet = new ServletHolder(container);
			apiServlet.setInitOrder(1);
			context.addServlet(apiServlet, "/*");

			// Start server
			this.server.start();

			LOGGER.info(() -> String.format("API listening on port %d", this.getPort()));
		} catch (Exception e) {
			// Failed to start
			throw new RuntimeException("Failed to start API", e);
		}
	}

	/** Port actually bound, which differs from settings when apiPort is 0. */
	public int getPort() {
		if (this.server == null)
			return -1;

		return ((ServerConnector) this.server.getConnectors()[0]).getLocalPort();
	}

	public void stop() {
		if (this.server == null)
			return;

		try {
			// Stop server
			this.server.stop();
		} catch (Exception e) {
			LOGGER.warn(String.format("Failed to stop API cleanly: %s", e.getMessage()));
		}

		this.server = null;
	}

}
