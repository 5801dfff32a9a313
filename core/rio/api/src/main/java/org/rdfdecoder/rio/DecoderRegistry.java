/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of the available {@link DecoderFactory} implementations, keyed by {@link Format}. The default instance is
 * populated from {@code META-INF/services/org.rdfdecoder.rio.DecoderFactory} entries on the classpath.
 */
public class DecoderRegistry {

	private static final Logger logger = LoggerFactory.getLogger(DecoderRegistry.class);

	private static class InstanceHolder {

		static final DecoderRegistry INSTANCE = new DecoderRegistry(DecoderRegistry.class.getClassLoader());
	}

	/**
	 * Returns the registry populated from the class loader of this class.
	 */
	public static DecoderRegistry getInstance() {
		return InstanceHolder.INSTANCE;
	}

	private final Map<Format, DecoderFactory> factories = new EnumMap<>(Format.class);

	public DecoderRegistry() {
	}

	public DecoderRegistry(ClassLoader classLoader) {
		ServiceLoader<DecoderFactory> loader = ServiceLoader.load(DecoderFactory.class, classLoader);
		try {
			for (DecoderFactory factory : loader) {
				add(factory);
			}
		} catch (ServiceConfigurationError e) {
			logger.error("Failed to instantiate decoder factory", e);
		}
	}

	/**
	 * Registers a factory, replacing any factory previously registered for the same format.
	 */
	public synchronized void add(DecoderFactory factory) {
		DecoderFactory old = factories.put(factory.getFormat(), factory);
		if (old != null) {
			logger.warn("Decoder factory {} replaces {} for format {}", factory.getClass().getName(),
					old.getClass().getName(), factory.getFormat());
		} else {
			logger.debug("Registered decoder factory {} for format {}", factory.getClass().getName(),
					factory.getFormat());
		}
	}

	public synchronized Optional<DecoderFactory> get(Format format) {
		return Optional.ofNullable(factories.get(format));
	}

	public synchronized boolean has(Format format) {
		return factories.containsKey(format);
	}

	public synchronized Set<Format> getFormats() {
		if (factories.isEmpty()) {
			return Collections.emptySet();
		}
		return Collections.unmodifiableSet(EnumSet.copyOf(factories.keySet()));
	}
}
