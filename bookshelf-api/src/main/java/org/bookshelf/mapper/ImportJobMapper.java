package org.bookshelf.mapper;

import org.bookshelf.model.dto.ImportItem;
import org.bookshelf.model.dto.ImportJob;
import org.bookshelf.model.entity.ImportItemEntity;
import org.bookshelf.model.entity.ImportJobEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ImportJobMapper {

    @Mapping(source = "user.id", target = "userId")
    @Mapping(source = "originalJob.id", target = "originalJobId")
    ImportJob toImportJob(ImportJobEntity entity);

    @Mapping(source = "job.id", target = "jobId")
    @Mapping(source = "book.id", target = "bookId")
    @Mapping(target = "status", expression = "java(entity.getStatus())")
    ImportItem toImportItem(ImportItemEntity entity);
}
