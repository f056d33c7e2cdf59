/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server;

import java.util.Map;

import jakarta.servlet.Servlet;
import org.apache.catalina.Context;
import org.apache.catalina.LifecycleException;
import org.apache.catalina.Wrapper;
import org.apache.catalina.startup.Tomcat;

/**
 * Starts an embedded Tomcat with a fixed set of servlets on the root context.
 */
public final class EmbeddedTomcat {

	private EmbeddedTomcat() {
	}

	/**
	 * Create and start a Tomcat server.
	 * @param host address to bind, {@code null} for all interfaces
	 * @param port port to bind, {@code 0} for an ephemeral one
	 * @param servlets servlets keyed by URL pattern
	 * @return the started server
	 * @throws LifecycleException if Tomcat fails to start
	 */
	public static Tomcat start(String host, int port, Map<String, Servlet> servlets) throws LifecycleException {
		var tomcat = new Tomcat();
		tomcat.setPort(port);
		if (host != null) {
			tomcat.getConnector().setProperty("address", host);
		}

		String baseDir = System.getProperty("java.io.tmpdir");
		tomcat.setBaseDir(baseDir);

		Context context = tomcat.addContext("", baseDir);

		int index = 0;
		for (Map.Entry<String, Servlet> entry : servlets.entrySet()) {
			String name = "servlet" + index++;
			Wrapper wrapper = context.createWrapper();
			wrapper.setName(name);
			wrapper.setServlet(entry.getValue());
			wrapper.setLoadOnStartup(1);
			context.addChild(wrapper);
			context.addServletMappingDecoded(entry.getKey(), name);
		}

		tomcat.start();
		return tomcat;
	}

	/**
	 * The port the connector actually bound.
	 */
	public static int localPort(Tomcat tomcat) {
		return tomcat.getConnector().getLocalPort();
	}

	public static void stop(Tomcat tomcat) throws LifecycleException {
		tomcat.stop();
		tomcat.destroy();
	}

}
