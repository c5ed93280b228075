package com.flamingo.ai.notionrag.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for indexing one page. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexPageRequest {

  private String label;

  @NotBlank(message = "Page ID or URL is required")
  private String page;

  private boolean force;
}
