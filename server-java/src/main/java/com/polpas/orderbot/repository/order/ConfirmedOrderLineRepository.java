package com.polpas.orderbot.repository.order;

import com.polpas.orderbot.conversation.model.OrderStatus;
import com.polpas.orderbot.model.ConfirmedOrderLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConfirmedOrderLineRepository extends JpaRepository<ConfirmedOrderLine, Long> {

    List<ConfirmedOrderLine> findByUserIdAndStatusOrderByOrderGroupAscProductAsc(String userId, OrderStatus status);

    @Query("SELECT l.product AS product, SUM(l.quantity) AS total FROM ConfirmedOrderLine l " +
            "WHERE l.userId = :userId AND l.status = :status AND l.orderGroup = :orderGroup " +
            "GROUP BY l.product ORDER BY SUM(l.quantity) DESC")
    List<ProductTotal> sumByProduct(@Param("userId") String userId,
                                    @Param("status") OrderStatus status,
                                    @Param("orderGroup") String orderGroup);

    @Modifying
    @Query("UPDATE ConfirmedOrderLine l SET l.status = :toStatus, l.orderGroup = :toGroup " +
            "WHERE l.userId = :userId AND l.orderGroup = :orderGroup AND l.status = :fromStatus")
    int moveGroup(@Param("userId") String userId,
                  @Param("orderGroup") String orderGroup,
                  @Param("fromStatus") OrderStatus fromStatus,
                  @Param("toStatus") OrderStatus toStatus,
                  @Param("toGroup") String toGroup);

    @Modifying
    @Query("DELETE FROM ConfirmedOrderLine l WHERE l.userId = :userId AND l.orderGroup = :orderGroup AND l.status = :status")
    int deleteGroup(@Param("userId") String userId,
                    @Param("orderGroup") String orderGroup,
                    @Param("status") OrderStatus status);

    interface ProductTotal {
        String getProduct();

        Long getTotal();
    }
}
