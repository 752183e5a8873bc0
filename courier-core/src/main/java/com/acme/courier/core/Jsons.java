package com.acme.courier.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;

/** Shared Jackson mapper for reading configuration documents. */
public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private Jsons() {}

  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (JsonProcessingException e) {
      throw new CourierException("Cannot read " + clazz.getSimpleName() + " from JSON", e);
    }
  }

  public static <T> T fromJson(InputStream in, Class<T> clazz) {
    try {
      return M.readValue(in, clazz);
    } catch (IOException e) {
      throw new CourierException("Cannot read " + clazz.getSimpleName() + " from JSON", e);
    }
  }
}
