package io.shortshop.ecommerce.domain.product;

import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import io.shortshop.ecommerce.domain.common.BaseEntity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(
    name = "product_images",
    indexes = {
        @Index(name = "idx_image_product_id", columnList = "product_id")
    }
)
@Getter
@NoArgsConstructor
public class ProductImage extends BaseEntity {

    public static final int IMAGE_URL_MAX_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false, foreignKey = @ForeignKey(name = "fk_image_product"))
    private Product product;

    @Column(length = ProductVariant.COLOR_MAX_LENGTH)
    private String color;

    @Column(name = "image_url", nullable = false, length = IMAGE_URL_MAX_LENGTH)
    private String imageUrl;

    static ProductImage create(Product product, String color, String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank() || imageUrl.length() > IMAGE_URL_MAX_LENGTH) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "Image url must be 1-" + IMAGE_URL_MAX_LENGTH + " characters"
            );
        }

        ProductImage image = new ProductImage();
        image.product = product;
        image.color = color;
        image.imageUrl = imageUrl;
        return image;
    }
}
