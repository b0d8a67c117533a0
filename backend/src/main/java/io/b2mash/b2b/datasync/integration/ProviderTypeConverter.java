package io.b2mash.b2b.datasync.integration;

import io.b2mash.b2b.datasync.exception.ResourceNotFoundException;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/** Binds {@code {provider}} path variables such as {@code /api/integrations/ecommerce/connect}. */
@Component
public class ProviderTypeConverter implements Converter<String, ProviderType> {

  @Override
  public ProviderType convert(String source) {
    return ProviderType.fromSlug(source.trim())
        .orElseThrow(() -> new ResourceNotFoundException("Provider", source));
  }
}
