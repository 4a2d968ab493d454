package fpt.com.patienttaskservices.domain.view.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingBoardDto {
    private List<PendingItemDto> labs;
    private List<PendingItemDto> imaging;
    private List<PendingItemDto> consultations;
    private List<PendingItemDto> archivedConsultations;
}
