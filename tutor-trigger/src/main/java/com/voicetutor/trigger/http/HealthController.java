package com.voicetutor.trigger.http;

import com.voicetutor.api.response.Response;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 存活探针。
 */
@RestController
public class HealthController {

    @GetMapping("/healthz")
    public Response<String> health() {
        return Response.success("ok");
    }
}
