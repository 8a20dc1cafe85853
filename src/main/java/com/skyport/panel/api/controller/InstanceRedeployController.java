package com.skyport.panel.api.controller;

import com.skyport.panel.api.model.AdminIdentity;
import com.skyport.panel.api.model.AuditAction;
import com.skyport.panel.api.model.AuditEvent;
import com.skyport.panel.api.model.RedeployQuery;
import com.skyport.panel.api.model.RedeployRequest;
import com.skyport.panel.api.model.RedeployResponse;
import com.skyport.panel.api.service.AdminIdentityResolver;
import com.skyport.panel.api.service.AuditRecorder;
import com.skyport.panel.api.service.RedeployFailureKind;
import com.skyport.panel.api.service.RedeployRequestValidator;
import com.skyport.panel.api.service.RedeploymentException;
import com.skyport.panel.api.service.RedeploymentService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/instances")
public class InstanceRedeployController {

    private final RedeploymentService redeploymentService;
    private final RedeployRequestValidator validator;
    private final AdminIdentityResolver identityResolver;
    private final AuditRecorder auditRecorder;

    public InstanceRedeployController(RedeploymentService redeploymentService,
                                      RedeployRequestValidator validator,
                                      AdminIdentityResolver identityResolver,
                                      AuditRecorder auditRecorder) {
        this.redeploymentService = redeploymentService;
        this.validator = validator;
        this.identityResolver = identityResolver;
        this.auditRecorder = auditRecorder;
    }

    @GetMapping({"/redeploy/{instanceId}", "/redeploy", "/redeploy/"})
    @ResponseStatus(HttpStatus.CREATED)
    public RedeployResponse redeploy(@PathVariable(required = false) String instanceId,
                                     @RequestParam(required = false) String image,
                                     @RequestParam(required = false) String memory,
                                     @RequestParam(required = false) String cpu,
                                     @RequestParam(required = false) String ports,
                                     @RequestParam(required = false) String name,
                                     @RequestParam(required = false) String user,
                                     @RequestParam(required = false) String primary,
                                     HttpServletRequest servletRequest) {
        String clientIp = servletRequest.getRemoteAddr();
        AdminIdentity actor = identityResolver.resolve(servletRequest);
        if (!actor.admin()) {
            auditRecorder.record(AuditEvent.of(actor, AuditAction.UNAUTHORIZED_ADMIN_ACCESS, clientIp, Map.of()));
            throw new RedeploymentException(RedeployFailureKind.FORBIDDEN, "Admin privileges required");
        }

        RedeployRequest request = validator.validate(
                instanceId,
                new RedeployQuery(image, memory, cpu, ports, name, user, primary)
        );
        return RedeployResponse.redeployed(redeploymentService.redeploy(actor, clientIp, request));
    }
}
