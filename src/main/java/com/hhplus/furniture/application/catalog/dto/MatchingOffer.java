package com.hhplus.furniture.application.catalog.dto;

import com.hhplus.furniture.domain.catalog.CatalogItem;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 선택한 상품과 어울리는 반대 계열 상품 추천 결과
 */
@Getter
@AllArgsConstructor
public class MatchingOffer {

    public static final String UNIQUE_ITEM_MESSAGE = "You have chosen a unique item! Good choice!";

    private final boolean matched;
    private final Long catalogItemId;
    private final String message;

    public static MatchingOffer none() {
        return new MatchingOffer(false, null, UNIQUE_ITEM_MESSAGE);
    }

    public static MatchingOffer of(CatalogItem match) {
        StringBuilder text = new StringBuilder("*** SPECIAL OFFER !!! ***\n");
        if (match.getKind().isTable()) {
            text.append("We found a matching table for your chair!\n")
                    .append("Description: ").append(match.getDescription()).append('\n')
                    .append("Material: ").append(match.getMaterial()).append('\n')
                    .append("It's the perfect table for you, and it's in stock!");
        } else {
            text.append("We found a matching chair for your table!\n")
                    .append("Description: ").append(match.getDescription()).append('\n')
                    .append("Adjustable: ").append(match.isAdjustable() ? "Yes" : "No").append('\n')
                    .append("Has Armrest: ").append(match.isArmrest() ? "Yes" : "No").append('\n')
                    .append("It's the perfect chair for you, and it's in stock!");
        }
        return new MatchingOffer(true, match.getId(), text.toString());
    }
}
