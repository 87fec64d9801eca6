package com.autonomous.shellagent.service.shell;

import com.autonomous.shellagent.config.AgentProperties;
import com.autonomous.shellagent.model.SessionProfile;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ShellTransportFactory {

    private final AgentProperties properties;

    public ShellTransportFactory(AgentProperties properties) {
        this.properties = properties;
    }

    public ShellTransport open(SessionProfile profile) {
        List<String> command = profile.getShellCommand() != null && !profile.getShellCommand().isEmpty()
            ? profile.getShellCommand()
            : properties.getShellCommand();
        return new LocalProcessShellTransport(command, profile.getWorkingDirectory(), profile.getEnvironment());
    }
}
