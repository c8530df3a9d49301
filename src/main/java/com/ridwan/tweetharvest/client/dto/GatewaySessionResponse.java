package com.ridwan.tweetharvest.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GatewaySessionResponse {

  @JsonProperty("authenticated")
  private boolean authenticated;

  @JsonProperty("screen_name")
  private String screenName;
}
