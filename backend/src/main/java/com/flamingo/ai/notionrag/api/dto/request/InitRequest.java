package com.flamingo.ai.notionrag.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a full index. With a database URL the label is registered first; without one
 * the label is resolved against the registry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InitRequest {

  @Size(max = 100, message = "Label must be at most 100 characters")
  private String label;

  private String databaseUrl;
}
