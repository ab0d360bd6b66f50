package com.riskrecon.worker.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "venues")
public class VenueProperties {
  private List<Paper> paper = new ArrayList<>();

  public List<Paper> getPaper() {
    return paper;
  }

  public void setPaper(List<Paper> paper) {
    this.paper = paper;
  }

  public static class Paper {
    private String name;

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }
  }
}
