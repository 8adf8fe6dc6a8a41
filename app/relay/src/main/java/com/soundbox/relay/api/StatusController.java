/*
 * Where: Relay API
 * What: Plain liveness response at the root path
 */
package com.soundbox.relay.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "soundbox-relay: ok";
  }
}
