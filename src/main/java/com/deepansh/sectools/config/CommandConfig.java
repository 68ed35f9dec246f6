package com.deepansh.sectools.config;

import com.deepansh.sectools.core.CommandAllowlist;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CommandConfig {

    @Bean
    public CommandAllowlist commandAllowlist(ToolProperties toolProperties) {
        return new CommandAllowlist(toolProperties.commands().getAllowedList());
    }
}
