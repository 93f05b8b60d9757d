package com.e2eq.access.util;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Resolves configured resource locations.
 * Supported prefixes:
 * <ul>
 *   <li>{@code classpath:} load from the context class loader (the default)</li>
 *   <li>{@code file:} load from the filesystem</li>
 *   <li>No prefix: treated as a classpath resource name</li>
 * </ul>
 */
public final class ResourceLocations {

   public static final String CLASSPATH_PREFIX = "classpath:";
   public static final String FILE_PREFIX = "file:";

   private ResourceLocations() {
   }

   public static InputStream open(String location) throws IOException {
      if (location == null || location.isBlank()) {
         throw new IOException("Resource location is empty");
      }
      if (location.startsWith(FILE_PREFIX)) {
         return new FileInputStream(location.substring(FILE_PREFIX.length()));
      }
      String resourceName = location.startsWith(CLASSPATH_PREFIX)
              ? location.substring(CLASSPATH_PREFIX.length())
              : location;
      if (resourceName.startsWith("/")) {
         resourceName = resourceName.substring(1);
      }
      ClassLoader loader = Thread.currentThread().getContextClassLoader();
      if (loader == null) {
         loader = ResourceLocations.class.getClassLoader();
      }
      InputStream is = loader.getResourceAsStream(resourceName);
      if (is == null) {
         throw new IOException("Could not find resource: " + location);
      }
      return is;
   }

   public static byte[] readBytes(String location) throws IOException {
      try (InputStream is = open(location)) {
         byte[] bytes = is.readAllBytes();
         if (bytes.length == 0) {
            throw new IOException("Resource is empty: " + location);
         }
         return bytes;
      }
   }

   public static String readString(String location) throws IOException {
      return new String(readBytes(location), StandardCharsets.UTF_8);
   }
}
