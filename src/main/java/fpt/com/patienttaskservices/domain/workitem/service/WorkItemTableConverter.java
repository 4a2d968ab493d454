package fpt.com.patienttaskservices.domain.workitem.service;

import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemTable;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Binds {@code {table}} path variables by store name ({@code tasks}, {@code oldlabs}, ...).
 */
@Component
public class WorkItemTableConverter implements Converter<String, WorkItemTable> {

    @Override
    public WorkItemTable convert(String source) {
        return WorkItemTable.fromStoreName(source);
    }
}
