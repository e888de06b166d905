package org.urbanscope.cli;

import com.typesafe.config.Config;
import org.urbanscope.datapipeline.api.resources.IResource;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * Instantiates resources from a configuration block holding {@code className} and {@code options}.
 * <p>
 * The class must implement the requested interface and expose a public
 * {@code (String name, Config options)} constructor. A block without {@code options} passes
 * itself, minus {@code className}, as options.
 */
public final class ResourceFactory {

    private ResourceFactory() {
    }

    /**
     * Creates a resource instance.
     *
     * @param name              logical name of the instance, used in logs and reports
     * @param resourceInterface interface the class has to implement
     * @param config            the resource block
     * @param <T>               the resource interface
     * @return the configured resource
     * @throws IllegalArgumentException if the block is incomplete or the class does not fit
     * @throws IllegalStateException    if the constructor fails
     */
    public static <T extends IResource> T create(String name, Class<T> resourceInterface, Config config) {
        if (!config.hasPath("className")) {
            throw new IllegalArgumentException("Resource '" + name + "' is missing 'className'");
        }
        String className = config.getString("className");
        Config options = config.hasPath("options") ? config.getConfig("options") : config.withoutPath("className");

        Class<?> resourceClass;
        try {
            resourceClass = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Resource '" + name + "': class not found: " + className, e);
        }
        if (!resourceInterface.isAssignableFrom(resourceClass)) {
            throw new IllegalArgumentException(String.format("Resource '%s': %s does not implement %s",
                name, className, resourceInterface.getName()));
        }
        try {
            Constructor<?> constructor = resourceClass.getConstructor(String.class, Config.class);
            return resourceInterface.cast(constructor.newInstance(name, options));
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Failed to create resource '" + name + "': " + cause.getMessage(), cause);
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Resource '" + name + "': " + className
                + " has no public (String, Config) constructor", e);
        }
    }
}
